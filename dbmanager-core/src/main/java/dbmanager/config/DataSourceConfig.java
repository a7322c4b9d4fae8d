package dbmanager.config;

/**
 * Descriptor of a data source: how to reach it and which engine speaks to it.
 *
 * @param dsn  data-source descriptor, either a JDBC URL or the engine's native DSN form
 * @param type engine type, e.g. {@code mysql}, {@code postgres}, {@code sqlite}, {@code h2}
 */
public record DataSourceConfig(String dsn, String type) {

  public static DataSourceConfig of(String dsn, String type) {
    return new DataSourceConfig(dsn, type);
  }
}
