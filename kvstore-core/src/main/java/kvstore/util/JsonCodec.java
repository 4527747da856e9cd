package kvstore.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts between JSON text, Java values and {@link JsonNode} trees.
 *
 * <p>Every backend persists values as JSON, either as text (file, JDBC, Firestore)
 * or as a native document (MongoDB). The default implementation
 * ({@link JacksonJsonCodec}) delegates to a shared Jackson {@code ObjectMapper};
 * callers that need custom serialization features can supply their own.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the default Jackson-backed codec.
   *
   * @return the shared {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Serializes a tree to compact JSON text. A {@code null} tree is written as {@code "null"}.
   *
   * @param value the tree to encode
   * @return JSON text (never {@code null})
   */
  String toJson(JsonNode value);

  /**
   * Parses JSON text into a tree.
   *
   * @param json the JSON text
   * @return the parsed tree; {@code NullNode} for {@code null} or blank input
   * @throws IllegalArgumentException if the text is not valid JSON
   */
  JsonNode parse(String json);

  /**
   * Converts an arbitrary Java value (map, list, record, primitive) into a tree.
   *
   * @param value the value to convert
   * @return the tree representation
   * @throws IllegalArgumentException if the value cannot be represented as JSON
   */
  JsonNode valueToTree(Object value);

  /** Creates an empty, mutable JSON object. */
  ObjectNode createObject();
}
