package dbmanager.slf4j;

import dbmanager.RecordNotFoundException;
import dbmanager.config.LogConfig;
import dbmanager.config.SlowQueryConfig;
import dbmanager.log.DbLogger;
import dbmanager.log.DbLoggers;
import dbmanager.log.LogLevel;
import dbmanager.log.TraceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link DbLogger} adapter onto SLF4J.
 *
 * <p>Messages are written with their {@code data} rendered as {@code key=value} pairs. Statement
 * traces go to the {@code dbmanager.sql} logger as failed (ERROR), slow (WARN) or plain (INFO),
 * with the elapsed time and row count also published in the MDC under {@value #MDC_ELAPSED_MS}
 * and {@value #MDC_ROWS} for the duration of the call.
 *
 * <pre>{@code
 * DbManager db = JdbcDbManager.create(config, Slf4jDbLogger.from(config.log(), config.slowQuery()));
 * }</pre>
 */
public final class Slf4jDbLogger implements DbLogger {
  public static final String LOGGER_NAME = "dbmanager.sql";
  public static final String MDC_ELAPSED_MS = "sql.elapsed_ms";
  public static final String MDC_ROWS = "sql.rows";
  private static final long DEFAULT_SLOW_THRESHOLD_MS = 200;

  private final Logger sink;
  private final LogLevel level;
  private final Duration slowThreshold;
  private final boolean ignoreRecordNotFoundError;
  private final boolean parameterizedQueries;

  private Slf4jDbLogger(Logger sink, LogLevel level, Duration slowThreshold,
      boolean ignoreRecordNotFoundError, boolean parameterizedQueries) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.level = Objects.requireNonNull(level, "level");
    this.slowThreshold = Objects.requireNonNull(slowThreshold, "slowThreshold");
    this.ignoreRecordNotFoundError = ignoreRecordNotFoundError;
    this.parameterizedQueries = parameterizedQueries;
  }

  /**
   * Creates an info-level logger on {@value #LOGGER_NAME} with a 200 ms slow threshold.
   */
  public static Slf4jDbLogger create() {
    return of(LoggerFactory.getLogger(LOGGER_NAME), LogLevel.INFO);
  }

  /**
   * Creates a logger writing to {@code sink} at {@code level} with a 200 ms slow threshold.
   */
  public static Slf4jDbLogger of(Logger sink, LogLevel level) {
    return new Slf4jDbLogger(sink, level, Duration.ofMillis(DEFAULT_SLOW_THRESHOLD_MS), false, false);
  }

  /**
   * Creates a logger from the logging and slow-query options of a manager configuration.
   */
  public static Slf4jDbLogger from(LogConfig log, SlowQueryConfig slowQuery) {
    Duration threshold = slowQuery.enabled()
        ? slowQuery.threshold()
        : Duration.ofMillis(DEFAULT_SLOW_THRESHOLD_MS);
    return new Slf4jDbLogger(LoggerFactory.getLogger(LOGGER_NAME), log.logLevel(), threshold,
        log.ignoreRecordNotFoundError(), log.parameterizedQueries());
  }

  public LogLevel level() {
    return level;
  }

  @Override
  public DbLogger setLevel(LogLevel level) {
    return new Slf4jDbLogger(sink, level, slowThreshold, ignoreRecordNotFoundError,
        parameterizedQueries);
  }

  @Override
  public void info(String message, Object... data) {
    if (level.allows(LogLevel.INFO) && sink.isInfoEnabled()) {
      sink.info(DbLoggers.withFields(message, data));
    }
  }

  @Override
  public void warn(String message, Object... data) {
    if (level.allows(LogLevel.WARN) && sink.isWarnEnabled()) {
      sink.warn(DbLoggers.withFields(message, data));
    }
  }

  @Override
  public void error(String message, Object... data) {
    if (level.allows(LogLevel.ERROR) && sink.isErrorEnabled()) {
      sink.error(DbLoggers.withFields(message, data));
    }
  }

  @Override
  public void trace(Instant begin, Supplier<TraceResult> result, Throwable error) {
    if (level == LogLevel.SILENT) {
      return;
    }
    Duration elapsed = Duration.between(begin, Instant.now());
    Throwable failure = ignoreRecordNotFoundError && error instanceof RecordNotFoundException
        ? null
        : error;

    if (failure != null && level.allows(LogLevel.ERROR)) {
      TraceResult r = result.get();
      withMdc(elapsed, r, () -> sink.error("{} | {}", line(elapsed, r), failure.getMessage()));
    } else if (isSlow(elapsed) && level.allows(LogLevel.WARN)) {
      TraceResult r = result.get();
      withMdc(elapsed, r,
          () -> sink.warn("SLOW SQL >= {}ms {}", slowThreshold.toMillis(), line(elapsed, r)));
    } else if (level.allows(LogLevel.INFO) && sink.isInfoEnabled()) {
      TraceResult r = result.get();
      withMdc(elapsed, r, () -> sink.info(line(elapsed, r)));
    }
  }

  private boolean isSlow(Duration elapsed) {
    return !slowThreshold.isZero() && elapsed.compareTo(slowThreshold) > 0;
  }

  private String line(Duration elapsed, TraceResult r) {
    String rows = r.rowsAffected() < 0 ? "-" : Long.toString(r.rowsAffected());
    return String.format(Locale.ROOT, "[%.3fms] [rows:%s] %s",
        elapsed.toNanos() / 1_000_000.0, rows, r.render(!parameterizedQueries));
  }

  private static void withMdc(Duration elapsed, TraceResult r, Runnable emission) {
    MDC.put(MDC_ELAPSED_MS, Long.toString(elapsed.toMillis()));
    MDC.put(MDC_ROWS, Long.toString(r.rowsAffected()));
    try {
      emission.run();
    } finally {
      MDC.remove(MDC_ELAPSED_MS);
      MDC.remove(MDC_ROWS);
    }
  }
}
