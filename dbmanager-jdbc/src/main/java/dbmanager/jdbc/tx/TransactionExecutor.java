package dbmanager.jdbc.tx;

import dbmanager.TransactionCallback;
import dbmanager.TransactionException;
import dbmanager.jdbc.client.ConnectionSqlClient;
import dbmanager.jdbc.client.StatementTracer;
import dbmanager.spi.MetricsExporter;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Runs a callback inside one primary transaction.
 *
 * <p>The transaction commits only when the callback returns normally. If the callback throws
 * anything, checked exceptions and errors included, the transaction is rolled back and the
 * original throwable is rethrown unchanged; a rollback failure is attached to it as suppressed.
 */
public final class TransactionExecutor {
  private final JdbcTransactionManager txManager;
  private final StatementTracer tracer;
  private final MetricsExporter metrics;

  public TransactionExecutor(JdbcTransactionManager txManager, StatementTracer tracer,
                             MetricsExporter metrics) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.tracer = Objects.requireNonNull(tracer, "tracer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public <T, E extends Exception> T execute(TransactionCallback<T, E> callback) throws E {
    if (callback == null) {
      throw new TransactionException("transaction function cannot be nil");
    }

    JdbcTransactionManager.Transaction tx;
    try {
      tx = txManager.begin();
    } catch (SQLException e) {
      throw new TransactionException("failed to begin transaction", e);
    }

    T result;
    try {
      result = callback.doInTransaction(new ConnectionSqlClient(tx.connection(), tracer));
    } catch (Throwable t) {
      rollback(tx, t);
      throw t;
    }

    try {
      tx.commit();
    } catch (SQLException e) {
      metrics.incrementTransactionRolledBack();
      throw new TransactionException("failed to commit transaction", e);
    }
    metrics.incrementTransactionCommitted();
    return result;
  }

  private void rollback(JdbcTransactionManager.Transaction tx, Throwable cause) {
    try {
      tx.rollback();
    } catch (SQLException | RuntimeException e) {
      cause.addSuppressed(e);
    }
    metrics.incrementTransactionRolledBack();
  }
}
