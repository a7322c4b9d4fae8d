package dbmanager.jdbc.client;

import dbmanager.RecordNotFoundException;
import dbmanager.SqlClient;
import dbmanager.SqlExecutionException;
import dbmanager.config.DataSourceConfig;
import dbmanager.config.SlowQueryConfig;
import dbmanager.jdbc.RecordingDbLogger;
import dbmanager.jdbc.RecordingMetricsExporter;
import dbmanager.jdbc.pool.HikariDataSourceDriver;
import dbmanager.log.DbLogger;
import dbmanager.log.LogLevel;
import dbmanager.log.SlowQueryLogger;
import dbmanager.log.TraceResult;
import dbmanager.spi.DataSourceHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class SqlClientTest {
  private DataSourceHandle handle;
  private RecordingDbLogger logger;
  private RecordingMetricsExporter metrics;
  private SqlClient client;

  @BeforeEach
  void setup() {
    handle = new HikariDataSourceDriver()
        .open("primary", DataSourceConfig.of("mem:client_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "h2"));
    logger = new RecordingDbLogger();
    metrics = new RecordingMetricsExporter();
    client = new DataSourceSqlClient(handle,
        new StatementTracer(logger, new SlowQueryLogger(SlowQueryConfig.DISABLED, logger), metrics));
    client.execute("CREATE TABLE account (id INT PRIMARY KEY, name VARCHAR(64), created_at TIMESTAMP)");
  }

  @AfterEach
  void tearDown() {
    handle.close();
  }

  @Test
  void updatesAndQueriesAreTraced() {
    int rows = client.update("INSERT INTO account (id, name, created_at) VALUES (?, ?, ?)",
        1, "alice", Instant.parse("2024-01-01T00:00:00Z"));
    List<String> names = client.query("SELECT name FROM account WHERE id > ?", rs -> rs.getString(1), 0);

    assertEquals(1, rows);
    assertEquals(List.of("alice"), names);
    TraceResult insert = logger.traces.get(1);
    assertEquals(1, insert.rowsAffected());
    assertEquals(3, insert.params().size());
    TraceResult select = logger.traces.get(2);
    assertEquals("SELECT name FROM account WHERE id > ?", select.sql());
    assertEquals(1, select.rowsAffected());
    assertTrue(logger.traceErrors.isEmpty());
  }

  @Test
  void nullParamsAreBound() {
    client.update("INSERT INTO account (id, name) VALUES (?, ?)", 1, null);

    String name = client.queryOne("SELECT name FROM account WHERE id = ?", rs -> rs.getString(1), 1);
    assertNull(name);
  }

  @Test
  void queryOneWithoutRowIsRecordNotFound() {
    assertThrows(RecordNotFoundException.class,
        () -> client.queryOne("SELECT name FROM account WHERE id = ?", rs -> rs.getString(1), 42));

    assertEquals(1, logger.traceErrors.size());
    assertInstanceOf(RecordNotFoundException.class, logger.traceErrors.get(0));
  }

  @Test
  void sqlFailureIsWrappedAndTraced() {
    SqlExecutionException e = assertThrows(SqlExecutionException.class,
        () -> client.update("INSERT INTO missing_table VALUES (1)"));

    assertInstanceOf(SQLException.class, e.getCause());
    assertEquals(1, logger.traceErrors.size());
    assertSame(e.getCause(), logger.traceErrors.get(0));
  }

  @Test
  void connectionsAreReturned() {
    for (int i = 0; i < 50; i++) {
      client.query("SELECT 1", rs -> rs.getInt(1));
    }
    assertEquals(0, handle.pool().stats().inUse());
  }

  @Test
  void slowStatementsAreCounted() {
    SqlClient slow = new DataSourceSqlClient(handle, new StatementTracer(logger,
        new SlowQueryLogger(SlowQueryConfig.of(Duration.ofNanos(1)), logger), metrics));

    slow.query("SELECT 1", rs -> rs.getInt(1));

    assertEquals(1, metrics.slowStatements.get());
    assertTrue(logger.warnings.get(0).startsWith("slow statement detected"));
  }

  @Test
  void failingLoggerNeverFailsTheStatement() {
    DbLogger broken = new RecordingDbLogger() {
      @Override
      public void trace(Instant begin, Supplier<TraceResult> result, Throwable error) {
        throw new IllegalStateException("log sink closed");
      }
    };
    SqlClient tolerant = new DataSourceSqlClient(handle,
        new StatementTracer(broken, new SlowQueryLogger(SlowQueryConfig.DISABLED, broken), metrics));

    assertEquals(List.of(1), tolerant.query("SELECT 1", rs -> rs.getInt(1)));
    assertSame(broken, broken.setLevel(LogLevel.SILENT));
  }
}
