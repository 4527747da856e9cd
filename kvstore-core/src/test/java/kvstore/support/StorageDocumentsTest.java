package kvstore.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import kvstore.util.JsonCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StorageDocumentsTest {

  @TempDir
  Path dir;

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void writesKeyValueRecordLayout() throws IOException {
    Map<String, JsonNode> records = new LinkedHashMap<>();
    records.put("a", IntNode.valueOf(1));
    Path file = dir.resolve("storage.json");

    StorageDocuments.write(file, records, codec);

    assertEquals("{\"a\":{\"key\":\"a\",\"value\":1}}",
        Files.readString(file, StandardCharsets.UTF_8));
    assertFalse(Files.exists(dir.resolve("storage.json.tmp")));
  }

  @Test
  void missingFileReadsAsEmpty() throws IOException {
    assertTrue(StorageDocuments.read(dir.resolve("nope.json"), codec).isEmpty());
  }

  @Test
  void malformedRecordsAreSkipped() throws IOException {
    Path file = dir.resolve("storage.json");
    Files.writeString(file, "{\"a\":{\"key\":\"a\",\"value\":\"x\"},\"b\":42,\"c\":{\"key\":\"c\"}}");

    Map<String, JsonNode> records = StorageDocuments.read(file, codec);

    assertEquals(Map.of("a", TextNode.valueOf("x")), records);
  }

  @Test
  void nonObjectDocumentIsRejected() throws IOException {
    Path file = dir.resolve("storage.json");
    Files.writeString(file, "[1,2]");

    assertThrows(IllegalArgumentException.class, () -> StorageDocuments.read(file, codec));
    assertTrue(StorageDocuments.readQuietly(file).isEmpty());
  }
}
