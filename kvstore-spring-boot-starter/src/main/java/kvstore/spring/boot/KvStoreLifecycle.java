package kvstore.spring.boot;

import kvstore.KeyValueStore;
import kvstore.timeout.TimeoutManager;
import org.springframework.context.SmartLifecycle;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts the {@link TimeoutManager} and connects the {@link KeyValueStore} when the
 * application context starts. The manager is started first so persisted timeouts are
 * recovered on the store's ready signal.
 *
 * <p>Shutdown is left to the beans' destroy methods.
 */
public class KvStoreLifecycle implements SmartLifecycle {
  private static final Logger logger = Logger.getLogger(KvStoreLifecycle.class.getName());

  private final KeyValueStore store;
  private final TimeoutManager timeoutManager;
  private final KvStoreProperties props;
  private volatile boolean running;

  public KvStoreLifecycle(KeyValueStore store, TimeoutManager timeoutManager, KvStoreProperties props) {
    this.store = store;
    this.timeoutManager = timeoutManager;
    this.props = props;
  }

  @Override
  public void start() {
    timeoutManager.start();
    store.connect();
    running = true;
    if (props.isLogging()) {
      logger.log(Level.INFO, "{0} store established with tables {1}",
          new Object[]{props.getType(), store.tables()});
    }
  }

  @Override
  public void stop() {
    running = false;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return props.isAutoStartup();
  }
}
