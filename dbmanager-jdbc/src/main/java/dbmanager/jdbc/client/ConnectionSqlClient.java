package dbmanager.jdbc.client;

import java.sql.Connection;
import java.util.Objects;

/**
 * Runs every statement on one connection it does not own, e.g. inside a transaction.
 */
public final class ConnectionSqlClient extends AbstractSqlClient {
  private final Connection connection;

  public ConnectionSqlClient(Connection connection, StatementTracer tracer) {
    super(tracer);
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  protected Connection acquire(String sql) {
    return connection;
  }

  @Override
  protected void release(Connection conn) {
    // owned by the transaction
  }
}
