package dbmanager.pool;

import dbmanager.PoolException;
import dbmanager.config.PoolConfig;
import dbmanager.spi.ConnectionPool;
import dbmanager.spi.DataSourceHandle;

/**
 * Applies a {@link PoolConfig} to an opened handle. Zero fields are left at the pool default.
 */
public final class PoolController {

  private PoolController() {
  }

  /**
   * Applies the non-zero fields of {@code shape} to the handle's pool.
   *
   * @throws PoolException if the handle cannot report its pool, or the pool refuses a value
   */
  public static void apply(DataSourceHandle handle, PoolConfig shape) {
    ConnectionPool pool = handle.isClosed() ? null : handle.pool();
    if (pool == null) {
      throw new PoolException("failed to configure " + handle.name()
          + " connection pool: handle has no open pool");
    }
    try {
      // open before idle: the idle target is bounded by the open limit
      if (shape.maxOpenConnections() > 0) {
        pool.setMaxOpenConnections(shape.maxOpenConnections());
      }
      if (shape.maxIdleConnections() > 0) {
        pool.setMaxIdleConnections(shape.maxIdleConnections());
      }
      if (!shape.maxConnectionLifetime().isZero()) {
        pool.setMaxConnectionLifetime(shape.maxConnectionLifetime());
      }
      if (!shape.maxConnectionIdleTime().isZero()) {
        pool.setMaxConnectionIdleTime(shape.maxConnectionIdleTime());
      }
    } catch (RuntimeException e) {
      throw new PoolException("failed to configure " + handle.name() + " connection pool", e);
    }
  }
}
