package dbmanager.health;

import dbmanager.log.RecordingDbLogger;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

  private static Map<String, HealthStatus> snapshot(boolean replicaHealthy) {
    Map<String, HealthStatus> snapshot = new LinkedHashMap<>();
    snapshot.put("primary", HealthStatus.healthy(Instant.now(), Duration.ofMillis(1)));
    snapshot.put("replica_0", replicaHealthy
        ? HealthStatus.healthy(Instant.now(), Duration.ofMillis(1))
        : HealthStatus.unhealthy(Instant.now(), "ping failed: connection refused", Duration.ofMillis(1)));
    return snapshot;
  }

  @Test
  void runsPeriodicallyUntilClosed() throws Exception {
    CountDownLatch passes = new CountDownLatch(3);
    AtomicInteger count = new AtomicInteger();
    HealthMonitor monitor = new HealthMonitor(Duration.ofMillis(20), () -> {
      count.incrementAndGet();
      passes.countDown();
      return snapshot(true);
    }, new RecordingDbLogger());

    assertFalse(monitor.isRunning());
    monitor.start();
    assertTrue(monitor.isRunning());
    assertTrue(passes.await(2, TimeUnit.SECONDS));

    monitor.close();
    assertFalse(monitor.isRunning());
    int afterClose = count.get();
    Thread.sleep(100);
    assertEquals(afterClose, count.get());
  }

  @Test
  void warnsOncePerUnhealthySource() {
    RecordingDbLogger logger = new RecordingDbLogger();
    HealthMonitor monitor = new HealthMonitor(Duration.ofMinutes(1), () -> snapshot(false), logger);

    monitor.runOnce();

    assertEquals(1, logger.warnings().size());
    assertEquals("WARN database health check failed datasource=replica_0 error=ping failed: connection refused",
        logger.warnings().get(0));
    monitor.close();
  }

  @Test
  void failingPassDoesNotStopTheLoop() throws Exception {
    CountDownLatch passes = new CountDownLatch(2);
    HealthMonitor monitor = new HealthMonitor(Duration.ofMillis(20), () -> {
      passes.countDown();
      throw new IllegalStateException("boom");
    }, new RecordingDbLogger());

    monitor.start();
    assertTrue(passes.await(2, TimeUnit.SECONDS));
    monitor.close();
  }

  @Test
  void closeLetsRunningPassFinishUninterrupted() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    AtomicBoolean interrupted = new AtomicBoolean();
    AtomicBoolean finished = new AtomicBoolean();
    RecordingDbLogger logger = new RecordingDbLogger();
    HealthMonitor monitor = new HealthMonitor(Duration.ofMillis(10), () -> {
      entered.countDown();
      try {
        Thread.sleep(300);
      } catch (InterruptedException e) {
        interrupted.set(true);
        Thread.currentThread().interrupt();
      }
      finished.set(true);
      return snapshot(true);
    }, logger);

    monitor.start();
    assertTrue(entered.await(2, TimeUnit.SECONDS));
    monitor.close();

    assertTrue(finished.get(), "close returned before the pass finished");
    assertFalse(interrupted.get());
    assertTrue(logger.warnings().isEmpty());
  }

  @Test
  void closeIsIdempotentAndFinal() {
    HealthMonitor monitor = new HealthMonitor(Duration.ofMillis(10), () -> snapshot(true), new RecordingDbLogger());
    monitor.start();
    monitor.close();
    monitor.close();
    assertThrows(IllegalStateException.class, monitor::start);
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> new HealthMonitor(Duration.ZERO, () -> snapshot(true), new RecordingDbLogger()));
  }
}
