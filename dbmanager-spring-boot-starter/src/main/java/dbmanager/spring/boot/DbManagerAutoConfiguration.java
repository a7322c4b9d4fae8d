package dbmanager.spring.boot;

import dbmanager.DbManager;
import dbmanager.config.DbManagerConfig;
import dbmanager.jdbc.JdbcDbManager;
import dbmanager.log.DbLogger;
import dbmanager.log.DefaultDbLogger;
import dbmanager.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the database manager.
 *
 * <p>Activates when {@code dbmanager.primary.dsn} is set and wires a {@link JdbcDbManager} from
 * {@link DbManagerProperties}. A {@link MetricsExporter} bean, when present, receives the
 * manager's metrics. The manager is closed with the application context.
 *
 * @see DbManagerProperties
 * @see DbManagerMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(JdbcDbManager.class)
@ConditionalOnProperty(prefix = "dbmanager.primary", name = "dsn")
@EnableConfigurationProperties(DbManagerProperties.class)
public class DbManagerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DbManagerConfig dbManagerConfig(DbManagerProperties props) {
    return props.toConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public DbLogger dbLogger(DbManagerConfig config) {
    return DefaultDbLogger.from(config.log(), config.slowQuery());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DbManager dbManager(DbManagerConfig config, DbLogger logger,
      ObjectProvider<MetricsExporter> metricsProvider) {
    JdbcDbManager.Builder builder = JdbcDbManager.builder()
        .config(config)
        .logger(logger);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
