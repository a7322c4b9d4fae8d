package dbmanager.pool;

import dbmanager.PoolException;
import dbmanager.config.PoolConfig;
import dbmanager.spi.StubDataSourceHandle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoolControllerTest {

  @Test
  void appliesNonZeroFieldsOpenFirst() {
    StubDataSourceHandle handle = new StubDataSourceHandle("primary");
    PoolController.apply(handle, new PoolConfig(10, 5, Duration.ofMinutes(30), Duration.ofMinutes(5)));

    assertEquals(List.of("maxOpen=10", "maxIdle=5", "lifetime=PT30M", "idleTime=PT5M"), handle.pool.calls);
  }

  @Test
  void zeroFieldsKeepDefaults() {
    StubDataSourceHandle handle = new StubDataSourceHandle("primary");
    PoolController.apply(handle, PoolConfig.DEFAULT);
    assertTrue(handle.pool.calls.isEmpty());

    PoolController.apply(handle, PoolConfig.of(4, 0));
    assertEquals(List.of("maxOpen=4"), handle.pool.calls);
  }

  @Test
  void closedHandleFails() {
    StubDataSourceHandle handle = new StubDataSourceHandle("replica_0");
    handle.close();

    PoolException e = assertThrows(PoolException.class, () -> PoolController.apply(handle, PoolConfig.of(1, 1)));
    assertTrue(e.getMessage().contains("replica_0"));
  }

  @Test
  void handleWithoutPoolFails() {
    StubDataSourceHandle handle = new StubDataSourceHandle("primary");
    handle.poolAvailable = false;
    assertThrows(PoolException.class, () -> PoolController.apply(handle, PoolConfig.DEFAULT));
  }

  @Test
  void poolRefusalIsWrapped() {
    StubDataSourceHandle handle = new StubDataSourceHandle("primary");
    handle.pool.failure = new IllegalArgumentException("maxPoolSize cannot be less than 1");

    PoolException e = assertThrows(PoolException.class, () -> PoolController.apply(handle, PoolConfig.of(1, 0)));
    assertInstanceOf(IllegalArgumentException.class, e.getCause());
  }
}
