package dbmanager.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background threads for one manager pool, named {@code dbmanager-<pool>-<n>}.
 *
 * <p>Threads are daemons so a manager that was never closed does not keep the JVM alive. An
 * exception escaping a task run through {@link Thread#start()} is logged instead of being
 * printed to stderr.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String pool;
  private final AtomicInteger sequence = new AtomicInteger();

  private DaemonThreadFactory(String pool) {
    this.pool = pool;
  }

  /** Factory for the pool called {@code pool}, e.g. {@code "health"}. */
  public static DaemonThreadFactory forPool(String pool) {
    Objects.requireNonNull(pool, "pool");
    if (pool.isBlank()) {
      throw new IllegalArgumentException("pool name must not be blank");
    }
    return new DaemonThreadFactory(pool);
  }

  public String pool() {
    return pool;
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread worker = new Thread(task, "dbmanager-" + pool + "-" + sequence.incrementAndGet());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
    return worker;
  }
}
