package dbmanager.config;

import dbmanager.ConfigException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

  private static DbManagerConfig.Builder valid() {
    return DbManagerConfig.builder().primary("mem:primary", "h2");
  }

  @Test
  void acceptsMinimalConfig() {
    assertDoesNotThrow(() -> ConfigValidator.validate(valid().build()));
  }

  @Test
  void rejectsNullConfig() {
    ConfigException e = assertThrows(ConfigException.class, () -> ConfigValidator.validate(null));
    assertEquals("config cannot be null", e.getMessage());
  }

  @Test
  void rejectsEmptyPrimaryDsn() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(DbManagerConfig.builder().primary("", "h2").build()));
    assertEquals("primary database DSN cannot be empty", e.getMessage());
  }

  @Test
  void rejectsMissingPrimary() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(DbManagerConfig.builder().build()));
    assertEquals("primary database DSN cannot be empty", e.getMessage());
  }

  @Test
  void rejectsEmptyType() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(DbManagerConfig.builder().primary("mem:x", "").build()));
    assertEquals("database type cannot be empty", e.getMessage());
  }

  @Test
  void rejectsNegativePoolSizes() {
    ConfigException open = assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(valid().pool(PoolConfig.of(-1, 0)).build()));
    assertTrue(open.getMessage().contains("max open connections cannot be negative"));

    ConfigException idle = assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(valid().pool(PoolConfig.of(0, -1)).build()));
    assertTrue(idle.getMessage().contains("max idle connections cannot be negative"));
  }

  @Test
  void rejectsIdleAboveOpen() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(valid().pool(PoolConfig.of(5, 10)).build()));
    assertEquals("pool: max idle connections cannot be greater than max open connections", e.getMessage());
  }

  @Test
  void idleWithoutOpenLimitIsAllowed() {
    assertDoesNotThrow(() -> ConfigValidator.validate(valid().pool(PoolConfig.of(0, 10)).build()));
  }

  @Test
  void rejectsNegativeDurations() {
    PoolConfig negativeLifetime = new PoolConfig(0, 0, Duration.ofSeconds(-1), Duration.ZERO);
    assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(valid().pool(negativeLifetime).build()));

    PoolConfig negativeIdle = new PoolConfig(0, 0, Duration.ZERO, Duration.ofSeconds(-1));
    assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(valid().pool(negativeIdle).build()));
  }

  @Test
  void replicaRulesNameTheReplica() {
    ConfigException dsn = assertThrows(ConfigException.class, () -> ConfigValidator.validate(
        valid().replica(ReplicaConfig.of("mem:r0", "h2", 1)).replica(ReplicaConfig.of("", "h2", 1)).build()));
    assertEquals("replica_1 DSN cannot be empty", dsn.getMessage());

    ConfigException weight = assertThrows(ConfigException.class, () -> ConfigValidator.validate(
        valid().replica(ReplicaConfig.of("mem:r0", "h2", -1)).build()));
    assertEquals("replica_0 weight cannot be negative", weight.getMessage());

    ConfigException pool = assertThrows(ConfigException.class, () -> ConfigValidator.validate(
        valid().replica(new ReplicaConfig("mem:r0", "h2", 1, PoolConfig.of(2, 3))).build()));
    assertEquals("replica_0 pool: max idle connections cannot be greater than max open connections",
        pool.getMessage());
  }

  @Test
  void rejectsNullReplica() {
    ConfigException e = assertThrows(ConfigException.class,
        () -> ConfigValidator.validate(valid().replica(null).build()));
    assertEquals("replica_0 cannot be null", e.getMessage());
  }

  @Test
  void replicaWithoutTypeIsAllowed() {
    assertDoesNotThrow(() -> ConfigValidator.validate(valid().replica(ReplicaConfig.of("mem:r0", "", 1)).build()));
  }

  @Test
  void monitorRulesApplyOnlyWhenEnabled() {
    assertDoesNotThrow(() -> ConfigValidator.validate(
        valid().monitor(new MonitorConfig(false, Duration.ZERO, Duration.ZERO, -1)).build()));

    ConfigException interval = assertThrows(ConfigException.class, () -> ConfigValidator.validate(
        valid().monitor(MonitorConfig.every(Duration.ZERO, Duration.ofSeconds(1))).build()));
    assertEquals("health check interval must be positive when monitoring is enabled", interval.getMessage());

    ConfigException timeout = assertThrows(ConfigException.class, () -> ConfigValidator.validate(
        valid().monitor(MonitorConfig.every(Duration.ofSeconds(1), Duration.ofSeconds(-1))).build()));
    assertEquals("connection timeout must be positive when monitoring is enabled", timeout.getMessage());

    ConfigException retries = assertThrows(ConfigException.class, () -> ConfigValidator.validate(
        valid().monitor(new MonitorConfig(true, Duration.ofSeconds(1), Duration.ofSeconds(1), -1)).build()));
    assertEquals("max retries cannot be negative", retries.getMessage());
  }

  @Test
  void slowQueryThresholdMustBePositiveWhenEnabled() {
    ConfigException e = assertThrows(ConfigException.class, () -> ConfigValidator.validate(
        valid().slowQuery(new SlowQueryConfig(true, Duration.ZERO, false)).build()));
    assertEquals("slow query threshold must be positive when enabled", e.getMessage());

    assertDoesNotThrow(() -> ConfigValidator.validate(
        valid().slowQuery(new SlowQueryConfig(false, Duration.ZERO, false)).build()));
  }

  @Test
  void validationHasNoSideEffects() {
    DbManagerConfig config = valid().pool(PoolConfig.of(10, 5)).build();
    String before = config.toString();
    ConfigValidator.validate(config);
    ConfigValidator.validate(config);
    assertEquals(before, config.toString());
  }
}
