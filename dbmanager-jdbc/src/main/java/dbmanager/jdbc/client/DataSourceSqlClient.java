package dbmanager.jdbc.client;

import dbmanager.spi.DataSourceHandle;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Runs every statement on one data source, borrowing a pooled connection per statement.
 */
public final class DataSourceSqlClient extends AbstractSqlClient {
  private final DataSourceHandle handle;

  public DataSourceSqlClient(DataSourceHandle handle, StatementTracer tracer) {
    super(tracer);
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  /** Key of the data source this client runs on. */
  public String dataSourceName() {
    return handle.name();
  }

  @Override
  protected Connection acquire(String sql) throws SQLException {
    return handle.dataSource().getConnection();
  }

  @Override
  protected void release(Connection conn) throws SQLException {
    conn.close();
  }
}
