package dbmanager.jdbc.pool;

import com.zaxxer.hikari.metrics.IMetricsTracker;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts connection borrows that had to wait, fed by HikariCP's metrics hooks.
 *
 * <p>A borrow that takes at least {@link #WAIT_THRESHOLD} counts as a wait; so does a borrow
 * that timed out.
 */
final class WaitTracker implements IMetricsTracker {
  static final Duration WAIT_THRESHOLD = Duration.ofMillis(1);

  private final LongAdder waitCount = new LongAdder();
  private final LongAdder waitNanos = new LongAdder();

  @Override
  public void recordConnectionAcquiredNanos(long elapsedAcquiredNanos) {
    record(elapsedAcquiredNanos);
  }

  @Override
  public void recordConnectionTimeout() {
    waitCount.increment();
  }

  void record(long elapsedNanos) {
    if (elapsedNanos >= WAIT_THRESHOLD.toNanos()) {
      waitCount.increment();
      waitNanos.add(elapsedNanos);
    }
  }

  long waitCount() {
    return waitCount.sum();
  }

  Duration waitDuration() {
    return Duration.ofNanos(waitNanos.sum());
  }

  @Override
  public String toString() {
    return "WaitTracker{waitCount=" + waitCount() + ", waitMillis="
        + TimeUnit.NANOSECONDS.toMillis(waitNanos.sum()) + "}";
  }
}
