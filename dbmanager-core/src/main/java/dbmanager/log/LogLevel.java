package dbmanager.log;

import java.util.Locale;

/**
 * Statement logger verbosity, ordered from least to most verbose.
 */
public enum LogLevel {
  SILENT,
  ERROR,
  WARN,
  INFO;

  /**
   * Returns {@code true} if a logger at this level emits a message of {@code messageLevel}.
   */
  public boolean allows(LogLevel messageLevel) {
    return this != SILENT && messageLevel != SILENT && messageLevel.ordinal() <= ordinal();
  }

  /**
   * Parses a level name case-insensitively. {@code null}, empty and unknown names map to
   * {@link #INFO}.
   */
  public static LogLevel parse(String name) {
    if (name == null) {
      return INFO;
    }
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "silent" -> SILENT;
      case "error" -> ERROR;
      case "warn", "warning" -> WARN;
      default -> INFO;
    };
  }
}
