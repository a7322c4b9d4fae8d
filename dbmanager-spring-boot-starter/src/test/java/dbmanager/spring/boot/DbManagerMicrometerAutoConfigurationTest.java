package dbmanager.spring.boot;

import dbmanager.health.HealthStatus;
import dbmanager.micrometer.MicrometerMetricsExporter;
import dbmanager.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class DbManagerMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(DbManagerMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("dbmanager.metrics.name-prefix=orders.db").run(ctx -> {
      var registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("orders.db.transactions.committed").counter());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("dbmanager.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void backsOffWithoutRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(DbManagerMicrometerAutoConfiguration.class))
        .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      var exporter = ctx.getBean(MetricsExporter.class);
      assertFalse(exporter instanceof MicrometerMetricsExporter);
    });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customExporter() {
      return new MetricsExporter() {
        @Override
        public void incrementTransactionCommitted() {
        }

        @Override
        public void incrementTransactionRolledBack() {
        }

        @Override
        public void incrementSlowStatement() {
        }

        @Override
        public void recordHealth(String dataSource, HealthStatus status) {
        }
      };
    }
  }
}
