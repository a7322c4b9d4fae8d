package dbmanager.health;

import dbmanager.log.DbLogger;
import dbmanager.log.DbLoggers;
import dbmanager.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background loop running a health pass every interval.
 *
 * <p>The pass itself (probe every data source, install the snapshot) is supplied by the owner;
 * the monitor schedules it and reports each unhealthy data source as a warning through the
 * {@link DbLogger}. Unhealthy results are never fatal and never retried.
 *
 * <p>Two states: idle until {@link #start()}, running until {@link #close()}. A closed monitor
 * cannot be restarted. {@link #close()} returns only after an in-flight pass has finished.
 */
public final class HealthMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());
  private static final long SHUTDOWN_WAIT_SECONDS = 30;

  private final Duration interval;
  private final Supplier<Map<String, HealthStatus>> healthPass;
  private final DbLogger dbLogger;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> checkTask;
  private volatile boolean closed;

  /**
   * @param interval   period between two passes, must be positive
   * @param healthPass runs one complete pass and returns the installed snapshot
   * @param dbLogger   receives one warning per unhealthy data source
   */
  public HealthMonitor(Duration interval, Supplier<Map<String, HealthStatus>> healthPass, DbLogger dbLogger) {
    this.interval = Objects.requireNonNull(interval, "interval");
    this.healthPass = Objects.requireNonNull(healthPass, "healthPass");
    this.dbLogger = Objects.requireNonNull(dbLogger, "dbLogger");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
  }

  /**
   * Starts the periodic loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("HealthMonitor has been closed");
    }
    if (checkTask != null) {
      return;
    }
    long periodNanos = interval.toNanos();
    scheduler = Executors.newSingleThreadScheduledExecutor(DaemonThreadFactory.forPool("health"));
    checkTask = scheduler.scheduleAtFixedRate(this::runOnce, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
  }

  public boolean isRunning() {
    return checkTask != null && !closed;
  }

  /**
   * Executes a single pass. Called by the scheduler; may also be invoked directly.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    try {
      Map<String, HealthStatus> snapshot = healthPass.get();
      if (closed && Thread.currentThread().isInterrupted()) {
        return;
      }
      for (Map.Entry<String, HealthStatus> entry : snapshot.entrySet()) {
        HealthStatus status = entry.getValue();
        if (!status.healthy()) {
          DbLoggers.emitQuietly(() -> dbLogger.warn("database health check failed",
              "datasource", entry.getKey(), "error", status.errorMessage()));
        }
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Health check cycle failed", t);
    }
  }

  /**
   * Cancels the loop and waits for an in-flight pass to finish. Idempotent.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (checkTask != null) {
      checkTask.cancel(false);
      checkTask = null;
    }
    if (scheduler != null) {
      // no interrupt: a running pass completes with real results
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          logger.log(Level.WARNING, "Health monitor did not stop within {0}s", SHUTDOWN_WAIT_SECONDS);
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
      scheduler = null;
    }
  }
}
