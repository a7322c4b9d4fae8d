package dbmanager.micrometer;

import dbmanager.health.HealthStatus;
import dbmanager.pool.PoolStats;
import dbmanager.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends. Per-source gauges carry a
 * {@code datasource} tag ({@code primary}, {@code replica_0}, ...) and are registered the first
 * time a source is reported.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code dbmanager.transactions.committed}</li>
 *   <li>{@code dbmanager.transactions.rolledback}</li>
 *   <li>{@code dbmanager.statements.slow}</li>
 * </ul>
 *
 * <h3>Gauges (per data source)</h3>
 * <ul>
 *   <li>{@code dbmanager.health.up} (1 healthy, 0 unhealthy)</li>
 *   <li>{@code dbmanager.health.response.ms}</li>
 *   <li>{@code dbmanager.pool.open}, {@code dbmanager.pool.in.use}, {@code dbmanager.pool.idle}</li>
 *   <li>{@code dbmanager.pool.wait.count}, {@code dbmanager.pool.wait.ms}</li>
 *   <li>{@code dbmanager.pool.closed.max.idle}, {@code dbmanager.pool.closed.max.idle.time},
 *       {@code dbmanager.pool.closed.max.lifetime}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  static final String DATASOURCE_TAG = "datasource";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter committed;
  private final Counter rolledBack;
  private final Counter slowStatements;
  private final Map<String, SourceGauges> sources = new ConcurrentHashMap<>();
  private final List<Meter> sourceMeters = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "dbmanager"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "dbmanager");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.db"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.committed = Counter.builder(namePrefix + ".transactions.committed")
        .description("Transactions committed")
        .register(registry);
    this.rolledBack = Counter.builder(namePrefix + ".transactions.rolledback")
        .description("Transactions rolled back")
        .register(registry);
    this.slowStatements = Counter.builder(namePrefix + ".statements.slow")
        .description("Statements at or above the slow threshold")
        .register(registry);
  }

  @Override
  public void incrementTransactionCommitted() {
    if (closed) return;
    committed.increment();
  }

  @Override
  public void incrementTransactionRolledBack() {
    if (closed) return;
    rolledBack.increment();
  }

  @Override
  public void incrementSlowStatement() {
    if (closed) return;
    slowStatements.increment();
  }

  @Override
  public void recordHealth(String dataSource, HealthStatus status) {
    if (closed) return;
    SourceGauges gauges = gauges(dataSource);
    gauges.up.set(status.healthy() ? 1 : 0);
    gauges.responseMs.set(status.responseTime() == null ? 0 : status.responseTime().toMillis());
  }

  @Override
  public void recordPoolStats(String dataSource, PoolStats stats) {
    if (closed) return;
    SourceGauges gauges = gauges(dataSource);
    gauges.open.set(stats.openConnections());
    gauges.inUse.set(stats.inUse());
    gauges.idle.set(stats.idle());
    gauges.waitCount.set(stats.waitCount());
    gauges.waitMs.set(stats.waitDuration().toMillis());
    gauges.closedMaxIdle.set(stats.maxIdleClosed());
    gauges.closedMaxIdleTime.set(stats.maxIdleTimeClosed());
    gauges.closedMaxLifetime.set(stats.maxLifetimeClosed());
  }

  private SourceGauges gauges(String dataSource) {
    return sources.computeIfAbsent(dataSource, SourceGauges::new);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link dbmanager.DbManager} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(committed, rolledBack, slowStatements));
    meters.addAll(sourceMeters);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private final class SourceGauges {
    final AtomicLong up = new AtomicLong();
    final AtomicLong responseMs = new AtomicLong();
    final AtomicLong open = new AtomicLong();
    final AtomicLong inUse = new AtomicLong();
    final AtomicLong idle = new AtomicLong();
    final AtomicLong waitCount = new AtomicLong();
    final AtomicLong waitMs = new AtomicLong();
    final AtomicLong closedMaxIdle = new AtomicLong();
    final AtomicLong closedMaxIdleTime = new AtomicLong();
    final AtomicLong closedMaxLifetime = new AtomicLong();

    SourceGauges(String dataSource) {
      gauge(dataSource, ".health.up", up, "1 when the last probe succeeded");
      gauge(dataSource, ".health.response.ms", responseMs, "Response time of the last probe");
      gauge(dataSource, ".pool.open", open, "Open connections");
      gauge(dataSource, ".pool.in.use", inUse, "Connections in use");
      gauge(dataSource, ".pool.idle", idle, "Idle connections");
      gauge(dataSource, ".pool.wait.count", waitCount, "Borrows that waited for a connection");
      gauge(dataSource, ".pool.wait.ms", waitMs, "Total time spent waiting for a connection");
      gauge(dataSource, ".pool.closed.max.idle", closedMaxIdle, "Connections closed by the idle limit");
      gauge(dataSource, ".pool.closed.max.idle.time", closedMaxIdleTime, "Connections closed by the idle timeout");
      gauge(dataSource, ".pool.closed.max.lifetime", closedMaxLifetime, "Connections closed by the max lifetime");
    }

    private void gauge(String dataSource, String suffix, AtomicLong value, String description) {
      ToDoubleFunction<AtomicLong> read = AtomicLong::get;
      sourceMeters.add(Gauge.builder(namePrefix + suffix, value, read)
          .description(description)
          .tag(DATASOURCE_TAG, dataSource)
          .register(registry));
    }
  }
}
