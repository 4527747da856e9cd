package kvstore.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;

/**
 * Structural comparison of JSON trees.
 */
public final class JsonValues {

  // Numbers compare by value so that 1, 1.0 and 1L are the same stored value.
  private static final Comparator<JsonNode> NUMERIC_AWARE = (a, b) -> {
    if (a.isNumber() && b.isNumber()) {
      return a.decimalValue().compareTo(b.decimalValue());
    }
    return a.equals(b) ? 0 : 1;
  };

  private JsonValues() {}

  /**
   * Returns {@code true} when both trees have the same shape and values.
   * Object field order is ignored, array order is not. Java {@code null} and JSON
   * {@code null} are treated alike.
   */
  public static boolean deepEquals(JsonNode left, JsonNode right) {
    boolean leftNull = left == null || left.isNull() || left.isMissingNode();
    boolean rightNull = right == null || right.isNull() || right.isMissingNode();
    if (leftNull || rightNull) {
      return leftNull && rightNull;
    }
    return left.equals(NUMERIC_AWARE, right);
  }
}
