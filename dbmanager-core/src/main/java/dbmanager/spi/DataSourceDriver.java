package dbmanager.spi;

import dbmanager.ConnectionException;
import dbmanager.config.DataSourceConfig;

/**
 * Opens handles for data-source descriptors. The manager owns every handle it opens and closes
 * them on shutdown.
 */
@FunctionalInterface
public interface DataSourceDriver {

  /**
   * Opens a pooled handle.
   *
   * @param name   data-source key the handle is registered under
   * @param config DSN and engine type
   * @return an open handle
   * @throws ConnectionException if the engine is unknown or the data source cannot be reached
   */
  DataSourceHandle open(String name, DataSourceConfig config);
}
