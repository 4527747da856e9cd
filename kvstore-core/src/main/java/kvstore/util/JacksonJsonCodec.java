package kvstore.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String toJson(JsonNode value) {
    if (value == null) {
      return "null";
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize JSON value", e);
    }
  }

  @Override
  public JsonNode parse(String json) {
    if (json == null || json.isBlank()) {
      return NullNode.getInstance();
    }
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public JsonNode valueToTree(Object value) {
    return mapper.valueToTree(value);
  }

  @Override
  public ObjectNode createObject() {
    return mapper.createObjectNode();
  }
}
