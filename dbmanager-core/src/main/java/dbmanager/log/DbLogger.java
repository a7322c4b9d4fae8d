package dbmanager.log;

import java.time.Instant;
import java.util.function.Supplier;

/**
 * Logging capability used by the manager and its SQL clients. Any backend can satisfy it
 * through an adapter; the manager never depends on a concrete backend.
 *
 * <p>{@code data} arguments are rendered as {@code key=value} pairs when given in pairs, see
 * {@link DbLoggers#formatFields(Object...)}.
 *
 * @see DefaultDbLogger
 * @see SlowQueryLogger
 */
public interface DbLogger {

  /**
   * Returns a logger identical to this one except for its level. Implementations may return
   * {@code this} when the level has no meaning for them.
   */
  DbLogger setLevel(LogLevel level);

  void info(String message, Object... data);

  void warn(String message, Object... data);

  void error(String message, Object... data);

  /**
   * Records one executed statement.
   *
   * @param begin  when execution started
   * @param result lazily yields the statement text and affected rows
   * @param error  execution failure, or {@code null} on success
   */
  void trace(Instant begin, Supplier<TraceResult> result, Throwable error);
}
