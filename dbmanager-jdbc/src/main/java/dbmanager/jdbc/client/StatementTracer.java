package dbmanager.jdbc.client;

import dbmanager.log.DbLogger;
import dbmanager.log.DbLoggers;
import dbmanager.log.SlowQueryLogger;
import dbmanager.log.TraceResult;
import dbmanager.spi.MetricsExporter;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Reports executed statements to the statement logger, the slow-query logger and the slow
 * statement counter. Logger failures never reach the statement.
 */
public final class StatementTracer {
  private final DbLogger logger;
  private final SlowQueryLogger slowQueryLogger;
  private final MetricsExporter metrics;

  public StatementTracer(DbLogger logger, SlowQueryLogger slowQueryLogger, MetricsExporter metrics) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.slowQueryLogger = Objects.requireNonNull(slowQueryLogger, "slowQueryLogger");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public void trace(Instant begin, String sql, Object[] params, long rowsAffected, Throwable error) {
    List<Object> bound = params == null ? List.of() : Arrays.asList(params);
    Supplier<TraceResult> result = () -> new TraceResult(sql, bound, rowsAffected);
    DbLoggers.emitQuietly(() -> logger.trace(begin, result, error));
    DbLoggers.emitQuietly(() -> slowQueryLogger.trace(begin, result, error));
    if (slowQueryLogger.isSlow(Duration.between(begin, Instant.now()))) {
      metrics.incrementSlowStatement();
    }
  }
}
