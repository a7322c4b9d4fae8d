package dbmanager.spring.boot;

import dbmanager.micrometer.MicrometerMetricsExporter;
import dbmanager.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code dbmanager.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link DbManagerAutoConfiguration} so the {@link MetricsExporter} bean is
 * available to the manager. The manager closes the exporter, which removes its meters.
 */
@AutoConfiguration(before = DbManagerAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "dbmanager.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(DbManagerProperties.class)
public class DbManagerMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, DbManagerProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
