package kvstore;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A record produced by a table scan.
 *
 * @param key   the record key
 * @param value the stored value
 * @param index position of the record within the scanned snapshot
 */
public record Entry(String key, JsonNode value, int index) {

  public Entry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }
}
