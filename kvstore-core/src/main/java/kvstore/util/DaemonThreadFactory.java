package kvstore.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named daemon threads ({@code <prefix>1}, {@code <prefix>2}, ...).
 *
 * <p>Timer threads must never keep the JVM alive on their own, so every thread
 * produced here is a daemon.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private final String prefix;
  private final AtomicInteger sequence = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, prefix + sequence.getAndIncrement());
    thread.setDaemon(true);
    return thread;
  }
}
