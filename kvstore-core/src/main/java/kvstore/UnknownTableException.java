package kvstore;

/**
 * Thrown when an operation names a table that was not declared when the store was built.
 */
public class UnknownTableException extends StoreException {
  private final String table;

  public UnknownTableException(String table) {
    super("Unknown table: " + table);
    this.table = table;
  }

  public String table() {
    return table;
  }
}
