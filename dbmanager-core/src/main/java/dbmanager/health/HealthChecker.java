package dbmanager.health;

import dbmanager.spi.DataSourceHandle;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes a set of handles once, each bounded by a deadline.
 *
 * <p>Probes run concurrently on the supplied executor so one hung data source does not delay
 * the others. Every failure is captured in the returned {@link HealthStatus}; this class never
 * throws for a failing data source.
 */
public final class HealthChecker {
  private final ExecutorService probeExecutor;

  public HealthChecker(ExecutorService probeExecutor) {
    this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
  }

  /**
   * Probes every handle.
   *
   * @param handles handles in reporting order
   * @param timeout deadline of each probe
   * @return one status per handle, keyed by {@link DataSourceHandle#name()}, in input order
   */
  public Map<String, HealthStatus> check(List<DataSourceHandle> handles, Duration timeout) {
    Instant checkedAt = Instant.now();
    long startNanos = System.nanoTime();
    long deadlineNanos = startNanos + timeout.toNanos();

    List<Future<Duration>> probes = new ArrayList<>(handles.size());
    for (DataSourceHandle handle : handles) {
      probes.add(submit(handle, timeout));
    }

    Map<String, HealthStatus> result = new LinkedHashMap<>();
    for (int i = 0; i < handles.size(); i++) {
      DataSourceHandle handle = handles.get(i);
      result.put(handle.name(), await(probes.get(i), checkedAt, startNanos, deadlineNanos, timeout));
    }
    return result;
  }

  private Future<Duration> submit(DataSourceHandle handle, Duration timeout) {
    try {
      return probeExecutor.submit(() -> {
        long begin = System.nanoTime();
        handle.ping(timeout);
        return Duration.ofNanos(Math.max(1L, System.nanoTime() - begin));
      });
    } catch (RejectedExecutionException e) {
      return null;
    }
  }

  private static HealthStatus await(Future<Duration> probe, Instant checkedAt, long startNanos,
      long deadlineNanos, Duration timeout) {
    if (probe == null) {
      return HealthStatus.unhealthy(checkedAt, "ping failed: probe executor is shut down", Duration.ZERO);
    }
    try {
      long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
      Duration responseTime = probe.get(remaining, TimeUnit.NANOSECONDS);
      return HealthStatus.healthy(checkedAt, responseTime);
    } catch (TimeoutException e) {
      probe.cancel(true);
      return HealthStatus.unhealthy(checkedAt,
          "ping failed: health check timed out after " + timeout.toMillis() + "ms", elapsed(startNanos));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      return HealthStatus.unhealthy(checkedAt, "ping failed: " + cause.getMessage(), elapsed(startNanos));
    } catch (InterruptedException e) {
      probe.cancel(true);
      Thread.currentThread().interrupt();
      return HealthStatus.unhealthy(checkedAt, "ping failed: health check interrupted", elapsed(startNanos));
    }
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(Math.max(1L, System.nanoTime() - startNanos));
  }
}
