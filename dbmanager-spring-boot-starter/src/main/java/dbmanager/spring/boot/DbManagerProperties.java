package dbmanager.spring.boot;

import dbmanager.config.DataSourceConfig;
import dbmanager.config.DbManagerConfig;
import dbmanager.config.LogConfig;
import dbmanager.config.MonitorConfig;
import dbmanager.config.PoolConfig;
import dbmanager.config.ReplicaConfig;
import dbmanager.config.SlowQueryConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the database manager, bound from {@code dbmanager.*}.
 *
 * <pre>
 * dbmanager.primary.dsn=jdbc:mysql://db-primary:3306/app
 * dbmanager.primary.type=mysql
 * dbmanager.replicas[0].dsn=jdbc:mysql://db-replica-1:3306/app
 * dbmanager.replicas[0].weight=2
 * dbmanager.pool.max-open-connections=20
 * dbmanager.slow-query.enabled=true
 * dbmanager.slow-query.threshold=200ms
 * dbmanager.monitor.enabled=true
 * dbmanager.monitor.health-check-interval=30s
 * </pre>
 *
 * @see DbManagerAutoConfiguration
 */
@ConfigurationProperties(prefix = "dbmanager")
public class DbManagerProperties {

  private final Source primary = new Source();
  private List<Replica> replicas = new ArrayList<>();
  private final Pool pool = new Pool();
  private final Log log = new Log();
  private final SlowQuery slowQuery = new SlowQuery();
  private final Monitor monitor = new Monitor();
  private final Metrics metrics = new Metrics();

  public Source getPrimary() {
    return primary;
  }

  public List<Replica> getReplicas() {
    return replicas;
  }

  public void setReplicas(List<Replica> replicas) {
    this.replicas = replicas;
  }

  public Pool getPool() {
    return pool;
  }

  public Log getLog() {
    return log;
  }

  public SlowQuery getSlowQuery() {
    return slowQuery;
  }

  public Monitor getMonitor() {
    return monitor;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Converts the bound properties to a manager configuration. No validation happens here; the
   * manager validates at construction.
   */
  public DbManagerConfig toConfig() {
    DbManagerConfig.Builder builder = DbManagerConfig.builder()
        .primary(new DataSourceConfig(primary.getDsn(), primary.getType()))
        .pool(pool.toConfig())
        .log(new LogConfig(log.isEnabled(), log.getLevel(), log.isColorful(),
            log.isIgnoreRecordNotFoundError(), log.isParameterizedQueries()))
        .slowQuery(new SlowQueryConfig(slowQuery.isEnabled(), slowQuery.getThreshold(),
            slowQuery.isLogParams()))
        .monitor(new MonitorConfig(monitor.isEnabled(), monitor.getHealthCheckInterval(),
            monitor.getConnectionTimeout(), monitor.getMaxRetries()));
    for (Replica replica : replicas) {
      builder.replica(new ReplicaConfig(replica.getDsn(), replica.getType(), replica.getWeight(),
          replica.getPool().toConfig()));
    }
    return builder.build();
  }

  public static class Source {
    private String dsn;
    private String type;

    public String getDsn() {
      return dsn;
    }

    public void setDsn(String dsn) {
      this.dsn = dsn;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }
  }

  public static class Replica {
    private String dsn;
    /** Engine type; empty inherits the primary's. */
    private String type;
    private int weight = 1;
    private final Pool pool = new Pool();

    public String getDsn() {
      return dsn;
    }

    public void setDsn(String dsn) {
      this.dsn = dsn;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public int getWeight() {
      return weight;
    }

    public void setWeight(int weight) {
      this.weight = weight;
    }

    public Pool getPool() {
      return pool;
    }
  }

  public static class Pool {
    private int maxOpenConnections;
    private int maxIdleConnections;
    private Duration maxConnectionLifetime = Duration.ZERO;
    private Duration maxConnectionIdleTime = Duration.ZERO;

    public int getMaxOpenConnections() {
      return maxOpenConnections;
    }

    public void setMaxOpenConnections(int maxOpenConnections) {
      this.maxOpenConnections = maxOpenConnections;
    }

    public int getMaxIdleConnections() {
      return maxIdleConnections;
    }

    public void setMaxIdleConnections(int maxIdleConnections) {
      this.maxIdleConnections = maxIdleConnections;
    }

    public Duration getMaxConnectionLifetime() {
      return maxConnectionLifetime;
    }

    public void setMaxConnectionLifetime(Duration maxConnectionLifetime) {
      this.maxConnectionLifetime = maxConnectionLifetime;
    }

    public Duration getMaxConnectionIdleTime() {
      return maxConnectionIdleTime;
    }

    public void setMaxConnectionIdleTime(Duration maxConnectionIdleTime) {
      this.maxConnectionIdleTime = maxConnectionIdleTime;
    }

    PoolConfig toConfig() {
      return new PoolConfig(maxOpenConnections, maxIdleConnections, maxConnectionLifetime,
          maxConnectionIdleTime);
    }
  }

  public static class Log {
    private boolean enabled;
    private String level = "info";
    private boolean colorful;
    private boolean ignoreRecordNotFoundError;
    private boolean parameterizedQueries;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getLevel() {
      return level;
    }

    public void setLevel(String level) {
      this.level = level;
    }

    public boolean isColorful() {
      return colorful;
    }

    public void setColorful(boolean colorful) {
      this.colorful = colorful;
    }

    public boolean isIgnoreRecordNotFoundError() {
      return ignoreRecordNotFoundError;
    }

    public void setIgnoreRecordNotFoundError(boolean ignoreRecordNotFoundError) {
      this.ignoreRecordNotFoundError = ignoreRecordNotFoundError;
    }

    public boolean isParameterizedQueries() {
      return parameterizedQueries;
    }

    public void setParameterizedQueries(boolean parameterizedQueries) {
      this.parameterizedQueries = parameterizedQueries;
    }
  }

  public static class SlowQuery {
    private boolean enabled;
    private Duration threshold = Duration.ofMillis(200);
    private boolean logParams;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getThreshold() {
      return threshold;
    }

    public void setThreshold(Duration threshold) {
      this.threshold = threshold;
    }

    public boolean isLogParams() {
      return logParams;
    }

    public void setLogParams(boolean logParams) {
      this.logParams = logParams;
    }
  }

  public static class Monitor {
    private boolean enabled;
    private Duration healthCheckInterval = Duration.ofSeconds(30);
    private Duration connectionTimeout = Duration.ofSeconds(5);
    private int maxRetries = 3;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getHealthCheckInterval() {
      return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
      this.healthCheckInterval = healthCheckInterval;
    }

    public Duration getConnectionTimeout() {
      return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "dbmanager";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
