package kvstore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Table name validation and the declared-table rules shared by every backend.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "main";
  public static final String TIMEOUT_TABLE = "timeout";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /**
   * Resolves the table set a store is built with: {@value #DEFAULT_TABLE} when nothing
   * is declared, duplicates removed, and {@value #TIMEOUT_TABLE} always appended last.
   *
   * @param declared the caller's tables, may be {@code null} or empty
   * @return the immutable, ordered table list
   * @throws IllegalArgumentException if a name is invalid
   */
  public static List<String> declare(Collection<String> declared) {
    Set<String> tables = new LinkedHashSet<>();
    if (declared == null || declared.isEmpty()) {
      tables.add(DEFAULT_TABLE);
    } else {
      for (String table : declared) {
        tables.add(validate(table));
      }
    }
    tables.remove(TIMEOUT_TABLE);
    List<String> result = new ArrayList<>(tables);
    if (result.isEmpty()) {
      result.add(DEFAULT_TABLE);
    }
    result.add(TIMEOUT_TABLE);
    return List.copyOf(result);
  }
}
