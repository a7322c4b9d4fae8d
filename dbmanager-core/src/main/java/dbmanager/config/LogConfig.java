package dbmanager.config;

import dbmanager.log.LogLevel;

/**
 * Options of the default statement logger.
 *
 * @param enabled                   {@code false} silences the default logger entirely
 * @param level                     {@code silent}, {@code error}, {@code warn} or {@code info}
 * @param colorful                  wrap statement lines in ANSI colours
 * @param ignoreRecordNotFoundError trace empty single-row lookups as plain executions
 * @param parameterizedQueries      log statements with {@code ?} placeholders, not inlined values
 */
public record LogConfig(
    boolean enabled,
    String level,
    boolean colorful,
    boolean ignoreRecordNotFoundError,
    boolean parameterizedQueries
) {
  public static final LogConfig DISABLED = new LogConfig(false, "silent", false, false, false);

  public static LogConfig of(String level) {
    return new LogConfig(true, level, false, false, false);
  }

  /**
   * Effective level: {@link LogLevel#SILENT} when disabled, otherwise the parsed level.
   */
  public LogLevel logLevel() {
    return enabled ? LogLevel.parse(level) : LogLevel.SILENT;
  }
}
