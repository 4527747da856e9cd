package kvstore.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonValuesTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  private JsonNode json(String text) {
    return codec.parse(text);
  }

  @Test
  void integerAndDecimalWithSameValueAreEqual() {
    assertTrue(JsonValues.deepEquals(json("1"), json("1.0")));
    assertTrue(JsonValues.deepEquals(json("{\"a\":[1,2.50]}"), json("{\"a\":[1.0,2.5]}")));
  }

  @Test
  void objectFieldOrderIsIgnored() {
    assertTrue(JsonValues.deepEquals(json("{\"a\":1,\"b\":2}"), json("{\"b\":2,\"a\":1}")));
  }

  @Test
  void arrayOrderMatters() {
    assertFalse(JsonValues.deepEquals(json("[1,2]"), json("[2,1]")));
  }

  @Test
  void differentTypesAreNotEqual() {
    assertFalse(JsonValues.deepEquals(json("\"1\""), json("1")));
    assertFalse(JsonValues.deepEquals(json("{}"), json("[]")));
    assertFalse(JsonValues.deepEquals(json("{\"a\":1}"), json("{\"a\":1,\"b\":null}")));
  }

  @Test
  void nullsCompareAlike() {
    assertTrue(JsonValues.deepEquals(null, NullNode.getInstance()));
    assertFalse(JsonValues.deepEquals(null, json("0")));
  }
}
