package dbmanager.jdbc.engine;

/**
 * Where and as whom to connect.
 *
 * @param jdbcUrl  JDBC URL
 * @param username user name, {@code null} when carried by the URL or not needed
 * @param password password, {@code null} when carried by the URL or not needed
 */
public record JdbcTarget(String jdbcUrl, String username, String password) {

  public static JdbcTarget of(String jdbcUrl) {
    return new JdbcTarget(jdbcUrl, null, null);
  }

  @Override
  public String toString() {
    return "JdbcTarget{jdbcUrl=" + jdbcUrl + ", username=" + username + "}";
  }
}
