package dbmanager.log;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogLevelTest {

  @Test
  void levelsAreOrderedSilentToInfo() {
    assertTrue(LogLevel.SILENT.compareTo(LogLevel.ERROR) < 0);
    assertTrue(LogLevel.ERROR.compareTo(LogLevel.WARN) < 0);
    assertTrue(LogLevel.WARN.compareTo(LogLevel.INFO) < 0);
  }

  @Test
  void loggerEmitsMessagesAtOrBelowItsLevel() {
    assertTrue(LogLevel.WARN.allows(LogLevel.ERROR));
    assertTrue(LogLevel.WARN.allows(LogLevel.WARN));
    assertFalse(LogLevel.WARN.allows(LogLevel.INFO));
    assertTrue(LogLevel.INFO.allows(LogLevel.INFO));
    assertFalse(LogLevel.ERROR.allows(LogLevel.WARN));
  }

  @Test
  void silentEmitsNothing() {
    for (LogLevel level : LogLevel.values()) {
      assertFalse(LogLevel.SILENT.allows(level));
      assertFalse(level.allows(LogLevel.SILENT));
    }
  }

  @Test
  void parseIsCaseInsensitiveAndDefaultsToInfo() {
    assertEquals(LogLevel.SILENT, LogLevel.parse("Silent"));
    assertEquals(LogLevel.ERROR, LogLevel.parse("ERROR"));
    assertEquals(LogLevel.WARN, LogLevel.parse("warn"));
    assertEquals(LogLevel.WARN, LogLevel.parse("warning"));
    assertEquals(LogLevel.INFO, LogLevel.parse("info"));
    assertEquals(LogLevel.INFO, LogLevel.parse("verbose"));
    assertEquals(LogLevel.INFO, LogLevel.parse(""));
    assertEquals(LogLevel.INFO, LogLevel.parse(null));
  }
}
