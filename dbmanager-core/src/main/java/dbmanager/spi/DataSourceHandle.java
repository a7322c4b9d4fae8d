package dbmanager.spi;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;

/**
 * An opened data source owned by the manager: a pooled {@link DataSource} plus the liveness and
 * pool controls the manager needs.
 *
 * @see DataSourceDriver
 */
public interface DataSourceHandle extends AutoCloseable {

  /**
   * Data-source key, {@code primary} or {@code replica_<index>}.
   */
  String name();

  /**
   * The pooled data source. Connections obtained from it must be closed by the caller.
   */
  DataSource dataSource();

  /**
   * Checks liveness by borrowing a connection and validating it.
   *
   * @param timeout upper bound for the validation round trip
   * @throws SQLException if no valid connection could be obtained
   */
  void ping(Duration timeout) throws SQLException;

  /**
   * Live pool of this handle, or {@code null} when the handle cannot report one (never opened,
   * or already closed).
   */
  ConnectionPool pool();

  boolean isClosed();

  /**
   * Closes the pool and every physical connection. Idempotent.
   */
  @Override
  void close();
}
