package dbmanager.jdbc.client;

import dbmanager.routing.StatementClassifier;
import dbmanager.routing.StatementKind;
import dbmanager.spi.DataSourceHandle;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Picks the data source per statement: reads go to a replica, everything else (writes, DDL,
 * locking reads) to the primary.
 *
 * @see StatementClassifier
 */
public final class RoutingSqlClient extends AbstractSqlClient {

  /**
   * Resolves the data source for a statement kind.
   */
  @FunctionalInterface
  public interface HandleResolver {
    DataSourceHandle resolve(StatementKind kind);
  }

  private final HandleResolver resolver;

  public RoutingSqlClient(HandleResolver resolver, StatementTracer tracer) {
    super(tracer);
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  @Override
  protected Connection acquire(String sql) throws SQLException {
    return resolver.resolve(StatementClassifier.classify(sql)).dataSource().getConnection();
  }

  @Override
  protected void release(Connection conn) throws SQLException {
    conn.close();
  }
}
