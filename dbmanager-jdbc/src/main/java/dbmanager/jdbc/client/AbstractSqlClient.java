package dbmanager.jdbc.client;

import dbmanager.RecordNotFoundException;
import dbmanager.SqlClient;
import dbmanager.SqlExecutionException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC plumbing shared by the SQL clients. Subclasses decide which connection runs a statement
 * and whether it is closed afterwards.
 */
public abstract class AbstractSqlClient implements SqlClient {
  private static final Object[] NO_PARAMS = new Object[0];

  private final StatementTracer tracer;

  protected AbstractSqlClient(StatementTracer tracer) {
    this.tracer = Objects.requireNonNull(tracer, "tracer");
  }

  /**
   * Obtains the connection that runs {@code sql}.
   */
  protected abstract Connection acquire(String sql) throws SQLException;

  /**
   * Gives back a connection obtained from {@link #acquire(String)}.
   */
  protected abstract void release(Connection conn) throws SQLException;

  @Override
  public int update(String sql, Object... params) {
    Object[] args = params == null ? NO_PARAMS : params;
    Instant begin = Instant.now();
    int rows;
    try {
      rows = withConnection(sql, conn -> {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
          bindParams(ps, args);
          return ps.executeUpdate();
        }
      });
    } catch (SQLException e) {
      tracer.trace(begin, sql, args, 0, e);
      throw new SqlExecutionException("Failed to execute update", e);
    }
    tracer.trace(begin, sql, args, rows, null);
    return rows;
  }

  @Override
  public void execute(String sql) {
    Instant begin = Instant.now();
    try {
      withConnection(sql, conn -> {
        try (Statement stmt = conn.createStatement()) {
          return stmt.execute(sql);
        }
      });
    } catch (SQLException e) {
      tracer.trace(begin, sql, NO_PARAMS, 0, e);
      throw new SqlExecutionException("Failed to execute statement", e);
    }
    tracer.trace(begin, sql, NO_PARAMS, 0, null);
  }

  @Override
  public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
    Object[] args = params == null ? NO_PARAMS : params;
    Instant begin = Instant.now();
    List<T> results;
    try {
      results = withConnection(sql, conn -> select(conn, sql, mapper, args, 0));
    } catch (SQLException e) {
      tracer.trace(begin, sql, args, 0, e);
      throw new SqlExecutionException("Failed to execute query", e);
    }
    tracer.trace(begin, sql, args, results.size(), null);
    return results;
  }

  @Override
  public <T> T queryOne(String sql, RowMapper<T> mapper, Object... params) {
    Object[] args = params == null ? NO_PARAMS : params;
    Instant begin = Instant.now();
    List<T> results;
    try {
      results = withConnection(sql, conn -> select(conn, sql, mapper, args, 1));
    } catch (SQLException e) {
      tracer.trace(begin, sql, args, 0, e);
      throw new SqlExecutionException("Failed to execute query", e);
    }
    if (results.isEmpty()) {
      RecordNotFoundException notFound = new RecordNotFoundException("record not found");
      tracer.trace(begin, sql, args, 0, notFound);
      throw notFound;
    }
    tracer.trace(begin, sql, args, 1, null);
    return results.get(0);
  }

  @FunctionalInterface
  private interface ConnectionWork<R> {
    R run(Connection conn) throws SQLException;
  }

  private <R> R withConnection(String sql, ConnectionWork<R> work) throws SQLException {
    Connection conn = acquire(sql);
    try {
      return work.run(conn);
    } finally {
      release(conn);
    }
  }

  private static <T> List<T> select(Connection conn, String sql, RowMapper<T> mapper,
                                    Object[] params, int limit) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      if (limit > 0) {
        ps.setMaxRows(limit);
      }
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    }
  }

  static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }
}
