package dbmanager.jdbc.spi;

import dbmanager.jdbc.engine.JdbcTarget;

import java.util.List;

/**
 * SPI for database engine support: maps an engine type and its DSN to a JDBC target.
 *
 * <p>Register custom engines via {@code META-INF/services/dbmanager.jdbc.spi.Engine}.
 *
 * <p>Built-in engines: MySQL, PostgreSQL, SQLite, H2. The JDBC driver of the engine must be on
 * the class path; it is located through {@link java.sql.DriverManager}.
 *
 * @see dbmanager.jdbc.engine.Engines
 */
public interface Engine {

  /**
   * Unique identifier for this engine (e.g., "mysql", "postgres", "sqlite", "h2").
   */
  String name();

  /**
   * Other type names accepted for this engine (e.g., "postgresql", "sqlite3").
   */
  default List<String> aliases() {
    return List.of();
  }

  /**
   * Translates a DSN into a JDBC target. DSNs already in {@code jdbc:} form are used verbatim.
   *
   * @throws IllegalArgumentException if the DSN cannot be parsed
   */
  JdbcTarget translate(String dsn);
}
