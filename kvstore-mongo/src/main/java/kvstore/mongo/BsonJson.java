package kvstore.mongo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.types.Decimal128;

/**
 * Converts between Jackson trees and native BSON values node by node.
 *
 * <p>Field names are copied verbatim, so objects whose keys look like extended JSON
 * ({@code $date}, {@code $numberLong}) are stored as plain documents.
 */
final class BsonJson {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private BsonJson() {}

  static BsonValue toBson(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return BsonNull.VALUE;
    }
    if (value.isObject()) {
      BsonDocument doc = new BsonDocument();
      Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        doc.append(field.getKey(), toBson(field.getValue()));
      }
      return doc;
    }
    if (value.isArray()) {
      BsonArray array = new BsonArray();
      for (JsonNode element : value) {
        array.add(toBson(element));
      }
      return array;
    }
    if (value.isInt() || value.isShort()) {
      return new BsonInt32(value.intValue());
    }
    if (value.isLong()) {
      return new BsonInt64(value.longValue());
    }
    if (value.isBigInteger() || value.isBigDecimal()) {
      return decimal(value.decimalValue());
    }
    if (value.isNumber()) {
      return new BsonDouble(value.doubleValue());
    }
    if (value.isBoolean()) {
      return BsonBoolean.valueOf(value.booleanValue());
    }
    if (value.isBinary()) {
      return new BsonBinary(((BinaryNode) value).binaryValue());
    }
    if (value.isTextual()) {
      return new BsonString(value.textValue());
    }
    throw new IllegalArgumentException("Unsupported JSON node: " + value.getNodeType());
  }

  static JsonNode toJson(BsonValue value) {
    if (value == null) {
      return NODES.nullNode();
    }
    switch (value.getBsonType()) {
      case DOCUMENT:
        ObjectNode object = NODES.objectNode();
        for (Map.Entry<String, BsonValue> field : value.asDocument().entrySet()) {
          object.set(field.getKey(), toJson(field.getValue()));
        }
        return object;
      case ARRAY:
        ArrayNode array = NODES.arrayNode();
        for (BsonValue element : value.asArray()) {
          array.add(toJson(element));
        }
        return array;
      case INT32:
        return NODES.numberNode(value.asInt32().getValue());
      case INT64:
        return NODES.numberNode(value.asInt64().getValue());
      case DOUBLE:
        return NODES.numberNode(value.asDouble().getValue());
      case DECIMAL128:
        return NODES.numberNode(value.asDecimal128().getValue().bigDecimalValue());
      case STRING:
        return NODES.textNode(value.asString().getValue());
      case BOOLEAN:
        return NODES.booleanNode(value.asBoolean().getValue());
      case BINARY:
        return NODES.binaryNode(value.asBinary().getData());
      case OBJECT_ID:
        return NODES.textNode(value.asObjectId().getValue().toHexString());
      case DATE_TIME:
        return NODES.numberNode(value.asDateTime().getValue());
      case NULL:
      case UNDEFINED:
        return NODES.nullNode();
      default:
        throw new IllegalArgumentException("Unsupported BSON type: " + value.getBsonType());
    }
  }

  // Decimal128 holds 34 significant digits; wider values are rejected rather than rounded.
  private static BsonDecimal128 decimal(BigDecimal value) {
    return new BsonDecimal128(new Decimal128(value));
  }
}
