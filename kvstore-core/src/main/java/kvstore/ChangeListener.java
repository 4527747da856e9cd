package kvstore;

/**
 * Functional {@link StoreListener} that only cares about data changes.
 *
 * <pre>{@code
 * store.subscribe((ChangeListener) event -> audit.record(event));
 * }</pre>
 */
@FunctionalInterface
public interface ChangeListener extends StoreListener {

  @Override
  void onChange(ChangeEvent event);
}
