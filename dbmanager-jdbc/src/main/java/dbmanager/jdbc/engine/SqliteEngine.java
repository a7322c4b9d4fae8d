package dbmanager.jdbc.engine;

/**
 * SQLite engine. The DSN is a file path, a {@code file:} URI or {@code :memory:}.
 */
public final class SqliteEngine extends AbstractEngine {

  public SqliteEngine() {
    super("sqlite", "sqlite3");
  }

  @Override
  protected JdbcTarget translateNative(String dsn) {
    return JdbcTarget.of("jdbc:sqlite:" + dsn);
  }
}
