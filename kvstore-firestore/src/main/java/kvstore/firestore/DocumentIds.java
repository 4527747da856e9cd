package kvstore.firestore;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Maps record keys to Firestore document ids.
 *
 * <p>Firestore ids may not contain {@code /}, may not be {@code .} or {@code ..} and may
 * not match {@code __.*__}. Keys are URL-encoded with dots escaped, and a reserved
 * {@code __...__} shape is broken by escaping its first underscore.
 */
final class DocumentIds {

  private DocumentIds() {}

  static String of(String key) {
    String id = URLEncoder.encode(key, StandardCharsets.UTF_8).replace(".", "%2E");
    if (id.startsWith("__") && id.endsWith("__")) {
      id = "%5F" + id.substring(1);
    }
    return id;
  }
}
