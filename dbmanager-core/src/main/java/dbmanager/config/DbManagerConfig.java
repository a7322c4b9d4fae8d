package dbmanager.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable manager configuration. Create instances via {@link #builder()}; the builder performs
 * no validation, {@link ConfigValidator} does.
 *
 * <pre>{@code
 * DbManagerConfig config = DbManagerConfig.builder()
 *     .primary("jdbc:mysql://db-primary:3306/app", "mysql")
 *     .replica(ReplicaConfig.of("jdbc:mysql://db-replica-1:3306/app", "mysql", 2))
 *     .replica(ReplicaConfig.of("jdbc:mysql://db-replica-2:3306/app", "mysql", 1))
 *     .pool(new PoolConfig(20, 10, Duration.ofHours(1), Duration.ofMinutes(30)))
 *     .slowQuery(SlowQueryConfig.of(Duration.ofMillis(200)))
 *     .monitor(MonitorConfig.every(Duration.ofSeconds(30), Duration.ofSeconds(5)))
 *     .build();
 * }</pre>
 */
public final class DbManagerConfig {
  private final DataSourceConfig primary;
  private final List<ReplicaConfig> replicas;
  private final PoolConfig pool;
  private final LogConfig log;
  private final SlowQueryConfig slowQuery;
  private final MonitorConfig monitor;

  private DbManagerConfig(Builder builder) {
    this.primary = builder.primary;
    this.replicas = Collections.unmodifiableList(new ArrayList<>(builder.replicas));
    this.pool = builder.pool;
    this.log = builder.log;
    this.slowQuery = builder.slowQuery;
    this.monitor = builder.monitor;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-filled with this configuration.
   */
  public Builder toBuilder() {
    Builder builder = new Builder()
        .primary(primary)
        .pool(pool)
        .log(log)
        .slowQuery(slowQuery)
        .monitor(monitor);
    builder.replicas.addAll(replicas);
    return builder;
  }

  public DataSourceConfig primary() {
    return primary;
  }

  /** Replicas in configuration order; index {@code i} is exposed as {@code replica_i}. */
  public List<ReplicaConfig> replicas() {
    return replicas;
  }

  public PoolConfig pool() {
    return pool;
  }

  public LogConfig log() {
    return log;
  }

  public SlowQueryConfig slowQuery() {
    return slowQuery;
  }

  public MonitorConfig monitor() {
    return monitor;
  }

  /**
   * Deadline used by explicit probes: the monitor's connection timeout when positive, otherwise
   * five seconds.
   */
  public Duration probeTimeout() {
    Duration timeout = monitor.connectionTimeout();
    return timeout.isNegative() || timeout.isZero() ? Duration.ofSeconds(5) : timeout;
  }

  @Override
  public String toString() {
    return "DbManagerConfig{primaryType=" + (primary == null ? null : primary.type())
        + ", replicas=" + replicas.size()
        + ", pool=" + pool
        + ", monitor=" + monitor.enabled()
        + ", slowQuery=" + slowQuery.enabled() + "}";
  }

  /** Builder for {@link DbManagerConfig}. */
  public static final class Builder {
    private DataSourceConfig primary;
    private final List<ReplicaConfig> replicas = new ArrayList<>();
    private PoolConfig pool = PoolConfig.DEFAULT;
    private LogConfig log = LogConfig.DISABLED;
    private SlowQueryConfig slowQuery = SlowQueryConfig.DISABLED;
    private MonitorConfig monitor = MonitorConfig.DISABLED;

    private Builder() {
    }

    /**
     * Sets the primary data source, the only one accepting writes.
     *
     * <p><b>Required.</b>
     */
    public Builder primary(DataSourceConfig primary) {
      this.primary = primary;
      return this;
    }

    public Builder primary(String dsn, String type) {
      return primary(new DataSourceConfig(dsn, type));
    }

    /**
     * Appends a read replica. Order matters: it determines the {@code replica_<index>} key.
     */
    public Builder replica(ReplicaConfig replica) {
      this.replicas.add(replica);
      return this;
    }

    public Builder replicas(List<ReplicaConfig> replicas) {
      this.replicas.clear();
      if (replicas != null) {
        this.replicas.addAll(replicas);
      }
      return this;
    }

    /**
     * Sets the global pool shape. Optional. Defaults to {@link PoolConfig#DEFAULT}.
     */
    public Builder pool(PoolConfig pool) {
      this.pool = pool == null ? PoolConfig.DEFAULT : pool;
      return this;
    }

    /**
     * Sets statement logging options. Optional. Defaults to {@link LogConfig#DISABLED}.
     */
    public Builder log(LogConfig log) {
      this.log = log == null ? LogConfig.DISABLED : log;
      return this;
    }

    /**
     * Sets slow statement detection. Optional. Defaults to {@link SlowQueryConfig#DISABLED}.
     */
    public Builder slowQuery(SlowQueryConfig slowQuery) {
      this.slowQuery = slowQuery == null ? SlowQueryConfig.DISABLED : slowQuery;
      return this;
    }

    /**
     * Sets background health monitoring. Optional. Defaults to {@link MonitorConfig#DISABLED}.
     */
    public Builder monitor(MonitorConfig monitor) {
      this.monitor = monitor == null ? MonitorConfig.DISABLED : monitor;
      return this;
    }

    public DbManagerConfig build() {
      return new DbManagerConfig(this);
    }
  }
}
