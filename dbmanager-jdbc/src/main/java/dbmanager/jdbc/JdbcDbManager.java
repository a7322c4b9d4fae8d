package dbmanager.jdbc;

import dbmanager.ConnectionException;
import dbmanager.DbManager;
import dbmanager.DbManagerException;
import dbmanager.SqlClient;
import dbmanager.TransactionCallback;
import dbmanager.config.ConfigValidator;
import dbmanager.config.DbManagerConfig;
import dbmanager.config.ReplicaConfig;
import dbmanager.health.HealthChecker;
import dbmanager.health.HealthMonitor;
import dbmanager.health.HealthStatus;
import dbmanager.jdbc.client.DataSourceSqlClient;
import dbmanager.jdbc.client.RoutingSqlClient;
import dbmanager.jdbc.client.StatementTracer;
import dbmanager.jdbc.pool.HikariDataSourceDriver;
import dbmanager.jdbc.tx.JdbcTransactionManager;
import dbmanager.jdbc.tx.TransactionExecutor;
import dbmanager.log.DbLogger;
import dbmanager.log.DefaultDbLogger;
import dbmanager.log.SlowQueryLogger;
import dbmanager.pool.PoolController;
import dbmanager.pool.PoolStats;
import dbmanager.routing.ConnectionRouter;
import dbmanager.routing.ReplicaPolicy;
import dbmanager.routing.StatementKind;
import dbmanager.routing.WeightedRandomPolicy;
import dbmanager.spi.ConnectionPool;
import dbmanager.spi.DataSourceDriver;
import dbmanager.spi.DataSourceHandle;
import dbmanager.spi.MetricsExporter;
import dbmanager.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DbManager} over HikariCP pools: one primary and any number of weighted replicas.
 *
 * <p>Construction validates the configuration, opens the primary and every replica and applies
 * their pool shapes, then starts the health monitor when enabled. If any step fails, every
 * data source opened so far is closed before the exception propagates.
 *
 * <p>One read/write lock guards the data-source references and the health snapshot. Routing and
 * statistics take the read lock; installing a snapshot and closing take the write lock. Probes
 * run outside the lock, so a slow database never blocks routing.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DbManagerConfig config = DbManagerConfig.builder()
 *     .primary("app:secret@tcp(db-primary:3306)/app", "mysql")
 *     .replica(ReplicaConfig.of("app:secret@tcp(db-replica:3306)/app", "mysql", 1))
 *     .monitor(MonitorConfig.every(Duration.ofSeconds(30), Duration.ofSeconds(5)))
 *     .build();
 *
 * try (DbManager db = JdbcDbManager.create(config)) {
 *   db.runTransaction(tx -> tx.update("UPDATE account SET balance = balance - ? WHERE id = ?", 10, 1));
 *   List<String> names = db.routed().query("SELECT name FROM account", rs -> rs.getString(1));
 * }
 * }</pre>
 */
public final class JdbcDbManager implements DbManager {
  private static final Logger logger = Logger.getLogger(JdbcDbManager.class.getName());
  private static final long PROBE_SHUTDOWN_WAIT_SECONDS = 5;

  static final String PRIMARY = "primary";
  static final String REPLICA_PREFIX = "replica_";

  private final DbManagerConfig config;
  private final DbLogger dbLogger;
  private final MetricsExporter metrics;
  private final StatementTracer tracer;
  private final DataSourceHandle primary;
  private final List<DataSourceHandle> handles;
  private final ConnectionRouter<DataSourceHandle> router;
  private final ExecutorService probeExecutor;
  private final HealthChecker healthChecker;
  private final HealthMonitor monitor;
  private final TransactionExecutor transactionExecutor;
  private final RoutingSqlClient routedClient;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicBoolean closing = new AtomicBoolean();
  private Map<String, HealthStatus> healthSnapshot = Map.of();
  private Instant lastHealthCheck;
  private boolean closed;

  private JdbcDbManager(Builder builder) {
    ConfigValidator.validate(builder.config);
    this.config = builder.config;
    this.dbLogger = builder.logger != null
        ? builder.logger
        : DefaultDbLogger.from(config.log(), config.slowQuery());
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.tracer = new StatementTracer(dbLogger, new SlowQueryLogger(config.slowQuery(), dbLogger), metrics);

    DataSourceDriver driver = builder.driver != null ? builder.driver : new HikariDataSourceDriver();
    this.handles = Collections.unmodifiableList(openAll(driver, config));
    this.primary = handles.get(0);

    List<ReplicaConfig> replicaConfigs = config.replicas();
    int[] weights = new int[replicaConfigs.size()];
    for (int i = 0; i < weights.length; i++) {
      weights[i] = replicaConfigs.get(i).weight();
    }
    ReplicaPolicy policy = builder.replicaPolicy != null ? builder.replicaPolicy : new WeightedRandomPolicy();
    this.router = new ConnectionRouter<>(primary, handles.subList(1, handles.size()), weights, policy);

    this.probeExecutor = Executors.newCachedThreadPool(DaemonThreadFactory.forPool("ping"));
    this.healthChecker = new HealthChecker(probeExecutor);
    this.transactionExecutor = new TransactionExecutor(
        new JdbcTransactionManager(() -> resolve(StatementKind.WRITE).dataSource().getConnection()),
        tracer, metrics);
    this.routedClient = new RoutingSqlClient(this::resolve, tracer);

    if (config.monitor().enabled()) {
      this.monitor = new HealthMonitor(config.monitor().healthCheckInterval(),
          () -> runHealthPass(config.monitor().connectionTimeout()), dbLogger);
      monitor.start();
    } else {
      this.monitor = null;
    }

    logger.log(Level.INFO, "Database manager started: primary={0}, replicas={1}, monitoring={2}",
        new Object[] {config.primary().type(), replicaConfigs.size(), config.monitor().enabled()});
  }

  /**
   * Creates a manager with the default statement logger built from the configuration.
   *
   * @throws dbmanager.ConfigException     if the configuration is invalid
   * @throws ConnectionException           if a data source cannot be opened
   * @throws dbmanager.PoolException       if a pool shape cannot be applied
   */
  public static JdbcDbManager create(DbManagerConfig config) {
    return builder().config(config).build();
  }

  /**
   * Creates a manager that traces statements through {@code logger}.
   */
  public static JdbcDbManager create(DbManagerConfig config, DbLogger logger) {
    return builder().config(config).logger(logger).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  private static List<DataSourceHandle> openAll(DataSourceDriver driver, DbManagerConfig config) {
    List<DataSourceHandle> opened = new ArrayList<>();
    try {
      DataSourceHandle primary = driver.open(PRIMARY, config.primary());
      opened.add(primary);
      PoolController.apply(primary, config.pool());

      List<ReplicaConfig> replicas = config.replicas();
      for (int i = 0; i < replicas.size(); i++) {
        ReplicaConfig replica = replicas.get(i);
        DataSourceHandle handle = driver.open(REPLICA_PREFIX + i, replica.toDataSource(config.primary().type()));
        opened.add(handle);
        PoolController.apply(handle, replica.effectivePool(config.pool()));
      }
      return opened;
    } catch (DbManagerException e) {
      unwind(opened, e);
      throw e;
    } catch (RuntimeException e) {
      ConnectionException wrapped = new ConnectionException("failed to open database", e);
      unwind(opened, wrapped);
      throw wrapped;
    }
  }

  private static void unwind(List<DataSourceHandle> opened, RuntimeException cause) {
    for (int i = opened.size() - 1; i >= 0; i--) {
      DataSourceHandle handle = opened.get(i);
      try {
        handle.close();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to close " + handle.name() + " while unwinding construction", e);
        cause.addSuppressed(e);
      }
    }
  }

  @Override
  public SqlClient routed() {
    ensureOpen();
    return routedClient;
  }

  @Override
  public SqlClient primary() {
    return new DataSourceSqlClient(resolve(StatementKind.WRITE), tracer);
  }

  @Override
  public SqlClient replica() {
    return new DataSourceSqlClient(resolve(StatementKind.READ), tracer);
  }

  @Override
  public <T, E extends Exception> T runTransaction(TransactionCallback<T, E> callback) throws E {
    ensureOpen();
    return transactionExecutor.execute(callback);
  }

  @Override
  public Map<String, HealthStatus> checkHealth(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    ensureOpen();
    return runHealthPass(timeout);
  }

  @Override
  public Map<String, HealthStatus> healthSnapshot() {
    lock.readLock().lock();
    try {
      return healthSnapshot;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Instant lastHealthCheck() {
    lock.readLock().lock();
    try {
      return lastHealthCheck;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public Map<String, PoolStats> stats() {
    lock.readLock().lock();
    try {
      ensureOpen();
      return collectStats();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void ping(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    DataSourceHandle target = resolve(StatementKind.WRITE);
    HealthStatus status = healthChecker.check(List.of(target), timeout).get(target.name());
    if (!status.healthy()) {
      throw new ConnectionException("primary database is unreachable: " + status.errorMessage());
    }
  }

  /**
   * Stops the health monitor, waits for a running pass to finish, then closes every data source.
   * Idempotent.
   *
   * @throws ConnectionException if a data source failed to close; the others are still closed
   */
  @Override
  public void close() {
    if (!closing.compareAndSet(false, true)) {
      return;
    }
    if (monitor != null) {
      monitor.close();
    }

    ConnectionException failure = null;
    lock.writeLock().lock();
    try {
      closed = true;
      for (DataSourceHandle handle : handles) {
        try {
          handle.close();
        } catch (RuntimeException e) {
          if (failure == null) {
            failure = new ConnectionException("failed to close database", e);
          } else {
            failure.addSuppressed(e);
          }
        }
      }
    } finally {
      lock.writeLock().unlock();
    }

    probeExecutor.shutdownNow();
    try {
      if (!probeExecutor.awaitTermination(PROBE_SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        logger.log(Level.WARNING, "Health probes did not terminate within {0}s",
            PROBE_SHUTDOWN_WAIT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }

    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        if (failure == null) {
          failure = new ConnectionException("failed to close metrics exporter", e);
        } else {
          failure.addSuppressed(e);
        }
      }
    }

    logger.log(Level.INFO, "Database manager closed");
    if (failure != null) {
      throw failure;
    }
  }

  public DbManagerConfig config() {
    return config;
  }

  private DataSourceHandle resolve(StatementKind kind) {
    lock.readLock().lock();
    try {
      ensureOpen();
      return router.route(kind);
    } finally {
      lock.readLock().unlock();
    }
  }

  private void ensureOpen() {
    if (closing.get()) {
      throw new ConnectionException("database manager is closed");
    }
  }

  private Map<String, HealthStatus> runHealthPass(Duration timeout) {
    List<DataSourceHandle> targets;
    lock.readLock().lock();
    try {
      if (closed) {
        return Map.of();
      }
      targets = handles;
    } finally {
      lock.readLock().unlock();
    }

    Map<String, HealthStatus> result = Collections.unmodifiableMap(healthChecker.check(targets, timeout));
    if (Thread.currentThread().isInterrupted()) {
      // probes were abandoned, the results do not describe the data sources
      return result;
    }

    Map<String, PoolStats> poolStats;
    lock.writeLock().lock();
    try {
      if (closed) {
        return result;
      }
      healthSnapshot = result;
      lastHealthCheck = Instant.now();
      poolStats = collectStats();
    } finally {
      lock.writeLock().unlock();
    }

    exportMetrics(result, poolStats);
    return result;
  }

  private Map<String, PoolStats> collectStats() {
    Map<String, PoolStats> result = new LinkedHashMap<>();
    for (DataSourceHandle handle : handles) {
      ConnectionPool pool = handle.pool();
      result.put(handle.name(), pool == null ? PoolStats.EMPTY : pool.stats());
    }
    return Collections.unmodifiableMap(result);
  }

  private void exportMetrics(Map<String, HealthStatus> health, Map<String, PoolStats> poolStats) {
    try {
      health.forEach(metrics::recordHealth);
      poolStats.forEach(metrics::recordPoolStats);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Metrics exporter failed", e);
    }
  }

  /**
   * Builder for {@link JdbcDbManager}. Only the configuration is required.
   */
  public static final class Builder {
    private DbManagerConfig config;
    private DbLogger logger;
    private MetricsExporter metrics;
    private DataSourceDriver driver;
    private ReplicaPolicy replicaPolicy;

    private Builder() {
    }

    public Builder config(DbManagerConfig config) {
      this.config = config;
      return this;
    }

    /** Statement logger; defaults to one built from the log and slow-query configuration. */
    public Builder logger(DbLogger logger) {
      this.logger = logger;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Opens data sources; defaults to {@link HikariDataSourceDriver}. */
    public Builder driver(DataSourceDriver driver) {
      this.driver = driver;
      return this;
    }

    /** Replica selection; defaults to {@link WeightedRandomPolicy}. */
    public Builder replicaPolicy(ReplicaPolicy replicaPolicy) {
      this.replicaPolicy = replicaPolicy;
      return this;
    }

    public JdbcDbManager build() {
      return new JdbcDbManager(this);
    }
  }
}
