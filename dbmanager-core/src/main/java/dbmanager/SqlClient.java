package dbmanager;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Statement surface handed out by the manager. Which data source executes a statement depends
 * on how the client was obtained: always the primary, a replica, auto-routed per statement, or
 * the single connection of a running transaction.
 *
 * <p>Every statement is traced through the manager's loggers. JDBC failures surface as
 * {@link SqlExecutionException}.
 *
 * @see DbManager#routed()
 * @see DbManager#primary()
 * @see DbManager#replica()
 */
public interface SqlClient {

  /**
   * Maps the current row of a result set.
   */
  @FunctionalInterface
  interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /**
   * Executes an INSERT, UPDATE, DELETE or other data-modifying statement.
   *
   * @return rows affected
   */
  int update(String sql, Object... params);

  /**
   * Executes a statement that returns no rows, typically DDL.
   */
  void execute(String sql);

  /**
   * Executes a query and maps every row.
   */
  <T> List<T> query(String sql, RowMapper<T> mapper, Object... params);

  /**
   * Executes a query expected to return a row and maps the first one.
   *
   * @throws RecordNotFoundException if the query returned no row
   */
  <T> T queryOne(String sql, RowMapper<T> mapper, Object... params);
}
