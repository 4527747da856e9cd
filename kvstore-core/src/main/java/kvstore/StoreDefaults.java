package kvstore;

import com.fasterxml.jackson.databind.JsonNode;
import kvstore.util.JsonCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Declared default values for named variables.
 *
 * <p>Defaults are seeded into a store without overwriting existing values, and can be
 * looked up later to reset a variable.
 *
 * <pre>{@code
 * StoreDefaults defaults = new StoreDefaults()
 *     .define("money", 0)
 *     .define("prefix", "!");
 * defaults.applyTo(store, "main");
 * }</pre>
 */
public final class StoreDefaults {
  private final Map<String, JsonNode> values = new LinkedHashMap<>();
  private final JsonCodec codec;

  public StoreDefaults() {
    this(JsonCodec.getDefault());
  }

  public StoreDefaults(JsonCodec codec) {
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public synchronized StoreDefaults define(String name, JsonNode value) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    values.put(name, value);
    return this;
  }

  /** Defines a default from a plain Java value (number, string, map, list). */
  public StoreDefaults define(String name, Object value) {
    return define(name, codec.valueToTree(value));
  }

  public synchronized Optional<JsonNode> defaultValue(String name) {
    return Optional.ofNullable(values.get(name));
  }

  public synchronized Map<String, JsonNode> asMap() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Seeds the defaults into the given tables (the store's first table when none given).
   *
   * @return the number of values written
   */
  public int applyTo(KeyValueStore store, String... tables) {
    return store.seed(asMap(), tables);
  }

  /**
   * Restores a variable to its declared default.
   *
   * @return {@code false} if no default is declared for {@code name}
   */
  public boolean reset(KeyValueStore store, String table, String name) {
    Optional<JsonNode> value = defaultValue(name);
    value.ifPresent(v -> store.set(table, name, v));
    return value.isPresent();
  }
}
