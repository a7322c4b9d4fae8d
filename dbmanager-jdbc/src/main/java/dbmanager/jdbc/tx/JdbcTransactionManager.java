package dbmanager.jdbc.tx;

import dbmanager.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Begins JDBC transactions on connections from a {@link ConnectionProvider}. The connection is
 * returned to its pool when the transaction completes.
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return new Transaction(connection);
  }

  /**
   * A running transaction. Closing it without a commit rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      return connection;
    }

    /** Commits. A failure to release the connection afterwards is logged, not thrown. */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        safeRollback(e);
        finalizeTx(e);
        throw e;
      }
      try {
        finalizeTx(null);
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Transaction committed but its connection could not be released", e);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        finalizeTx(e);
        throw e;
      }
      finalizeTx(null);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(SQLException pending) throws SQLException {
      completed = true;
      SQLException failure = null;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        failure = e;
      }
      try {
        connection.close();
      } catch (SQLException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
      if (failure == null) {
        return;
      }
      if (pending != null) {
        pending.addSuppressed(failure);
        return;
      }
      throw failure;
    }

    private void safeRollback(SQLException commitFailure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        commitFailure.addSuppressed(e);
      }
    }
  }
}
