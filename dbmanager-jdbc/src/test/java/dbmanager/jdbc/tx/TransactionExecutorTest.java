package dbmanager.jdbc.tx;

import dbmanager.TransactionException;
import dbmanager.config.LogConfig;
import dbmanager.config.SlowQueryConfig;
import dbmanager.jdbc.RecordingMetricsExporter;
import dbmanager.jdbc.client.StatementTracer;
import dbmanager.log.DefaultDbLogger;
import dbmanager.log.SlowQueryLogger;
import dbmanager.spi.ConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionExecutorTest {
  private JdbcDataSource dataSource;
  private RecordingMetricsExporter metrics;
  private StatementTracer tracer;

  @BeforeEach
  void setup() throws SQLException {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:tx_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TABLE account (id INT PRIMARY KEY, balance INT)");
      stmt.execute("INSERT INTO account VALUES (1, 100)");
    }
    metrics = new RecordingMetricsExporter();
    DefaultDbLogger logger = DefaultDbLogger.from(LogConfig.DISABLED, SlowQueryConfig.DISABLED);
    tracer = new StatementTracer(logger, new SlowQueryLogger(SlowQueryConfig.DISABLED, logger), metrics);
  }

  private TransactionExecutor executor(ConnectionProvider provider) {
    return new TransactionExecutor(new JdbcTransactionManager(provider), tracer, metrics);
  }

  private int balance() throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT balance FROM account WHERE id = 1")) {
      rs.next();
      return rs.getInt(1);
    }
  }

  @Test
  void commitsWhenCallbackReturns() throws SQLException {
    Integer rows = executor(dataSource::getConnection)
        .execute(tx -> tx.update("UPDATE account SET balance = balance - ? WHERE id = ?", 30, 1));

    assertEquals(1, rows);
    assertEquals(70, balance());
    assertEquals(1, metrics.committed.get());
    assertEquals(0, metrics.rolledBack.get());
  }

  @Test
  void nullCallbackFailsBeforeBegin() {
    int[] begins = {0};
    TransactionException e = assertThrows(TransactionException.class,
        () -> executor(() -> {
          begins[0]++;
          return dataSource.getConnection();
        }).execute(null));

    assertEquals("transaction function cannot be nil", e.getMessage());
    assertEquals(0, begins[0]);
  }

  @Test
  void beginFailureIsWrapped() {
    SQLException refused = new SQLException("too many connections");
    TransactionException e = assertThrows(TransactionException.class,
        () -> executor(() -> {
          throw refused;
        }).execute(tx -> 1));

    assertEquals("failed to begin transaction", e.getMessage());
    assertSame(refused, e.getCause());
  }

  @Test
  void runtimeExceptionRollsBackAndIsRethrownUnchanged() throws SQLException {
    IllegalStateException forced = new IllegalStateException("forced rollback");

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> executor(dataSource::getConnection).execute(tx -> {
          tx.update("UPDATE account SET balance = 0 WHERE id = 1");
          throw forced;
        }));

    assertSame(forced, thrown);
    assertEquals(100, balance());
    assertEquals(1, metrics.rolledBack.get());
  }

  @Test
  void checkedExceptionRollsBackAndIsRethrownUnchanged() throws SQLException {
    IOException failure = new IOException("upstream unavailable");

    IOException thrown = assertThrows(IOException.class,
        () -> executor(dataSource::getConnection).<Void, IOException>execute(tx -> {
          tx.update("UPDATE account SET balance = 0 WHERE id = 1");
          throw failure;
        }));

    assertSame(failure, thrown);
    assertEquals(100, balance());
  }

  @Test
  void errorRollsBackAndIsRethrownUnchanged() throws SQLException {
    Error panic = new Error("panic");

    Error thrown = assertThrows(Error.class,
        () -> executor(dataSource::getConnection).execute(tx -> {
          tx.update("UPDATE account SET balance = 0 WHERE id = 1");
          throw panic;
        }));

    assertSame(panic, thrown);
    assertEquals(100, balance());
  }

  @Test
  void rollbackFailureIsSuppressed() {
    IllegalStateException forced = new IllegalStateException("forced rollback");
    ConnectionProvider failingRollback = () -> failing(dataSource.getConnection(), "rollback");

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> executor(failingRollback).execute(tx -> {
          throw forced;
        }));

    assertSame(forced, thrown);
    assertEquals(1, thrown.getSuppressed().length);
    assertEquals("rollback refused", thrown.getSuppressed()[0].getMessage());
  }

  @Test
  void commitFailureIsWrapped() throws SQLException {
    ConnectionProvider failingCommit = () -> failing(dataSource.getConnection(), "commit");

    TransactionException e = assertThrows(TransactionException.class,
        () -> executor(failingCommit).execute(tx -> tx.update("UPDATE account SET balance = 0 WHERE id = 1")));

    assertEquals("failed to commit transaction", e.getMessage());
    assertEquals("commit refused", e.getCause().getMessage());
    assertEquals(100, balance());
    assertEquals(1, metrics.rolledBack.get());
  }

  @Test
  void releaseFailureAfterCommitStillReportsSuccess() throws SQLException {
    ConnectionProvider failingClose = () -> failing(dataSource.getConnection(), "close");

    Integer rows = executor(failingClose)
        .execute(tx -> tx.update("UPDATE account SET balance = balance - ? WHERE id = ?", 30, 1));

    assertEquals(1, rows);
    assertEquals(70, balance());
    assertEquals(1, metrics.committed.get());
    assertEquals(0, metrics.rolledBack.get());
  }

  private static Connection failing(Connection target, String method) {
    return (Connection) Proxy.newProxyInstance(Connection.class.getClassLoader(),
        new Class<?>[] {Connection.class}, (proxy, m, args) -> {
          if (m.getName().equals(method) && m.getParameterCount() == 0) {
            throw new SQLException(method + " refused");
          }
          try {
            return m.invoke(target, args);
          } catch (InvocationTargetException e) {
            throw e.getCause();
          }
        });
  }
}
