package dbmanager.log;

import dbmanager.config.SlowQueryConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class SlowQueryLoggerTest {

  private static final TraceResult SELECT =
      new TraceResult("SELECT * FROM account WHERE id = ?", List.of(42), 1);

  @Test
  void slowStatementIsRecordedAndForwarded() {
    RecordingDbLogger base = new RecordingDbLogger();
    SlowQueryLogger slow = new SlowQueryLogger(new SlowQueryConfig(true, Duration.ofMillis(100), true), base);

    try (CapturingHandler capture = CapturingHandler.attach(SlowQueryLogger.LOGGER_NAME)) {
      slow.trace(Instant.now().minusMillis(500), () -> SELECT, null);

      assertEquals(Level.WARNING, capture.only().getLevel());
      assertTrue(capture.only().getMessage().contains("sql=SELECT * FROM account WHERE id = 42"));
    }
    assertEquals(1, base.warnings().size());
    assertTrue(base.warnings().get(0).startsWith("WARN slow statement detected elapsed="));
    assertTrue(base.traces.isEmpty());
  }

  @Test
  void fastStatementIsIgnored() {
    RecordingDbLogger base = new RecordingDbLogger();
    SlowQueryLogger slow = new SlowQueryLogger(SlowQueryConfig.of(Duration.ofSeconds(10)), base);

    try (CapturingHandler capture = CapturingHandler.attach(SlowQueryLogger.LOGGER_NAME)) {
      slow.trace(Instant.now(), () -> SELECT, null);
      assertTrue(capture.records.isEmpty());
    }
    assertTrue(base.lines.isEmpty());
  }

  @Test
  void disabledNeverReportsAndIsNeverSlow() {
    RecordingDbLogger base = new RecordingDbLogger();
    SlowQueryLogger slow = new SlowQueryLogger(SlowQueryConfig.DISABLED, base);

    slow.trace(Instant.now().minusSeconds(60), () -> SELECT, null);
    assertTrue(base.lines.isEmpty());
    assertFalse(slow.isSlow(Duration.ofHours(1)));
  }

  @Test
  void thresholdIsInclusive() {
    SlowQueryLogger slow = new SlowQueryLogger(SlowQueryConfig.of(Duration.ofMillis(100)), new RecordingDbLogger());
    assertTrue(slow.isSlow(Duration.ofMillis(100)));
    assertFalse(slow.isSlow(Duration.ofMillis(99)));
  }

  @Test
  void paramsStayParameterizedUnlessRequested() {
    SlowQueryLogger slow = new SlowQueryLogger(new SlowQueryConfig(true, Duration.ofMillis(1), false),
        new RecordingDbLogger());
    try (CapturingHandler capture = CapturingHandler.attach(SlowQueryLogger.LOGGER_NAME)) {
      slow.trace(Instant.now().minusSeconds(1), () -> SELECT, null);
      assertTrue(capture.only().getMessage().contains("sql=SELECT * FROM account WHERE id = ?"));
    }
  }

  @Test
  void messagesDelegateToBase() {
    RecordingDbLogger base = new RecordingDbLogger();
    SlowQueryLogger slow = new SlowQueryLogger(SlowQueryConfig.DISABLED, base);

    slow.info("a");
    slow.warn("b", "k", 1);
    slow.error("c");
    assertEquals(List.of("INFO a", "WARN b k=1", "ERROR c"), base.lines);
    assertSame(slow, slow.setLevel(LogLevel.SILENT));
  }
}
