package kvstore.support;

import kvstore.StoreNotReadyException;
import kvstore.TableNames;
import kvstore.UnknownTableException;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lifecycle state and table checks shared by the backends.
 *
 * <p>A guard starts disconnected, becomes ready once, and is terminal after
 * {@link #close()}.
 */
public final class StoreGuard {
  private final String storeName;
  private final List<String> tables;
  private final Set<String> tableSet;
  private volatile boolean ready;
  private volatile boolean closed;

  public StoreGuard(String storeName, Collection<String> declaredTables) {
    this.storeName = storeName;
    this.tables = TableNames.declare(declaredTables);
    this.tableSet = new HashSet<>(tables);
  }

  public List<String> tables() {
    return tables;
  }

  public boolean isReady() {
    return ready;
  }

  /**
   * Marks the store ready.
   *
   * @return {@code true} only on the first transition
   * @throws IllegalStateException if the store was closed
   */
  public synchronized boolean markReady() {
    if (closed) {
      throw new IllegalStateException(storeName + " has been closed");
    }
    if (ready) {
      return false;
    }
    ready = true;
    return true;
  }

  public synchronized void close() {
    closed = true;
    ready = false;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Verifies the store is ready and the table was declared.
   *
   * @return the table name
   */
  public String check(String table) {
    if (!ready) {
      throw new StoreNotReadyException(storeName + " is not connected");
    }
    if (table == null || !tableSet.contains(table)) {
      throw new UnknownTableException(table);
    }
    return table;
  }
}
