package kvstore.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import kvstore.StoreException;
import kvstore.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads and writes the storage document format {@code {"<key>": {"key": "<key>", "value": ...}}}.
 *
 * <p>Used by the file backend for its table files and by every backend for bulk
 * import/export. Writes go to a sibling temp file that is then moved over the target
 * atomically, so a crash never leaves a half-written document.
 */
public final class StorageDocuments {
  private static final Logger logger = Logger.getLogger(StorageDocuments.class.getName());

  private StorageDocuments() {}

  /**
   * Parses a storage document. A missing or blank file is an empty table.
   *
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the content is not a JSON object
   */
  public static Map<String, JsonNode> read(Path file, JsonCodec codec) throws IOException {
    if (!Files.exists(file)) {
      return new LinkedHashMap<>();
    }
    return parse(Files.readString(file, StandardCharsets.UTF_8), codec, file);
  }

  /**
   * Like {@link #read}, but logs failures and returns an empty map.
   */
  public static Map<String, JsonNode> readQuietly(Path file) {
    try {
      return read(file, JsonCodec.getDefault());
    } catch (IOException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to read storage document " + file, e);
      return new LinkedHashMap<>();
    }
  }

  static Map<String, JsonNode> parse(String json, JsonCodec codec, Path source) {
    Map<String, JsonNode> records = new LinkedHashMap<>();
    JsonNode root = codec.parse(json);
    if (root.isNull()) {
      return records;
    }
    if (!root.isObject()) {
      throw new IllegalArgumentException("Storage document must be a JSON object: " + source);
    }
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode record = field.getValue();
      if (!record.isObject() || !record.has("value")) {
        logger.log(Level.WARNING, "Skipping malformed record {0} in {1}",
            new Object[]{field.getKey(), source});
        continue;
      }
      JsonNode key = record.get("key");
      String recordKey = key != null && key.isTextual() ? key.asText() : field.getKey();
      records.put(recordKey, record.get("value"));
    }
    return records;
  }

  public static String format(Map<String, JsonNode> records, JsonCodec codec) {
    ObjectNode root = codec.createObject();
    for (Map.Entry<String, JsonNode> record : records.entrySet()) {
      ObjectNode node = root.putObject(record.getKey());
      node.put("key", record.getKey());
      node.set("value", record.getValue() == null ? NullNode.getInstance() : record.getValue());
    }
    return codec.toJson(root);
  }

  /**
   * Atomically replaces {@code file} with the given records.
   */
  public static void write(Path file, Map<String, JsonNode> records, JsonCodec codec) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    Files.writeString(tmp, format(records, codec), StandardCharsets.UTF_8);
    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }

  /**
   * Like {@link #write}, but logs and rethrows failures as {@link StoreException}.
   */
  public static void writeOrThrow(Path file, Map<String, JsonNode> records) {
    try {
      write(file, records, JsonCodec.getDefault());
    } catch (IOException e) {
      logger.log(Level.SEVERE, "Failed to write storage document " + file, e);
      throw new StoreException("Failed to write storage document " + file, e);
    }
  }
}
