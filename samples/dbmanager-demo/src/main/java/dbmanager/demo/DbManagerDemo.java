package dbmanager.demo;

import dbmanager.DbManager;
import dbmanager.RecordNotFoundException;
import dbmanager.config.DbManagerConfig;
import dbmanager.config.LogConfig;
import dbmanager.config.MonitorConfig;
import dbmanager.config.PoolConfig;
import dbmanager.config.ReplicaConfig;
import dbmanager.config.SlowQueryConfig;
import dbmanager.health.HealthStatus;
import dbmanager.jdbc.JdbcDbManager;
import dbmanager.pool.PoolStats;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Simple demo showing the database manager against in-memory H2 databases.
 *
 * <p>Primary and replicas share one H2 database so that writes are visible on every source.
 *
 * Run with: mvn -pl samples/dbmanager-demo exec:java
 */
public final class DbManagerDemo {

  private static final String DB = "jdbc:h2:mem:demo;MODE=MySQL;DB_CLOSE_DELAY=-1";

  public static void main(String[] args) throws Exception {
    // 1. Describe primary, two weighted replicas and the ambient options
    DbManagerConfig config = DbManagerConfig.builder()
        .primary(DB, "h2")
        .replica(ReplicaConfig.of(DB, "", 2))
        .replica(new ReplicaConfig(DB, "h2", 1, PoolConfig.of(4, 2)))
        .pool(new PoolConfig(10, 5, Duration.ofMinutes(30), Duration.ofMinutes(5)))
        .log(LogConfig.of("info"))
        .slowQuery(SlowQueryConfig.of(Duration.ofMillis(100)))
        .monitor(MonitorConfig.every(Duration.ofSeconds(1), Duration.ofMillis(500)))
        .build();

    System.out.println("=== DB Manager Demo ===\n");

    try (DbManager db = JdbcDbManager.create(config)) {
      // 2. Schema and data go to the primary
      db.primary().execute("CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(64) NOT NULL)");
      db.primary().update("INSERT INTO users (id, name) VALUES (?, ?)", 1, "Alice");

      // 3. A transaction commits on success
      db.runTransaction(tx -> {
        tx.update("INSERT INTO users (id, name) VALUES (?, ?)", 2, "Bob");
        return tx.update("UPDATE users SET name = ? WHERE id = ?", "Alice Smith", 1);
      });
      System.out.println("Transaction committed\n");

      // 4. ... and rolls back when the callback fails
      try {
        db.runTransaction(tx -> {
          tx.update("INSERT INTO users (id, name) VALUES (?, ?)", 3, "Carol");
          throw new IllegalStateException("payment declined");
        });
      } catch (IllegalStateException e) {
        System.out.println("Transaction rolled back: " + e.getMessage() + "\n");
      }

      // 5. Routed reads go to a replica, locking reads and writes to the primary
      List<String> names = db.routed().query("SELECT name FROM users ORDER BY id",
          rs -> rs.getString(1));
      System.out.println("Users (replica): " + names);
      String locked = db.routed().queryOne("SELECT name FROM users WHERE id = ? FOR UPDATE",
          rs -> rs.getString(1), 2);
      System.out.println("Locked read (primary): " + locked + "\n");

      try {
        db.replica().queryOne("SELECT name FROM users WHERE id = ?", rs -> rs.getString(1), 3);
      } catch (RecordNotFoundException e) {
        System.out.println("User 3 not found, as expected\n");
      }

      // 6. Health and pool statistics
      Thread.sleep(1500);
      System.out.println("=== Health ===");
      for (Map.Entry<String, HealthStatus> e : db.checkHealth(Duration.ofSeconds(1)).entrySet()) {
        HealthStatus s = e.getValue();
        System.out.printf("%-10s | healthy=%-5s | %dms%n",
            e.getKey(), s.healthy(), s.responseTime().toMillis());
      }

      System.out.println("\n=== Pools ===");
      System.out.printf("%-10s | %-4s | %-6s | %-4s | %s%n", "SOURCE", "OPEN", "IN USE", "IDLE", "WAITS");
      System.out.println("-".repeat(48));
      for (Map.Entry<String, PoolStats> e : db.stats().entrySet()) {
        PoolStats s = e.getValue();
        System.out.printf("%-10s | %-4d | %-6d | %-4d | %d%n",
            e.getKey(), s.openConnections(), s.inUse(), s.idle(), s.waitCount());
      }
    }

    System.out.println("\nDemo complete.");
  }
}
