package dbmanager.jdbc.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * MySQL (and compatible) engine.
 *
 * <p>Native DSN form: {@code [user[:password]@][tcp[(host[:port])]]/dbname[?param=value&...]}.
 * Parameters that only make sense to other drivers ({@code parseTime}, {@code loc},
 * {@code charset}) are dropped; the rest are passed to the JDBC URL.
 */
public final class MySqlEngine extends AbstractEngine {
  private static final Set<String> DROPPED_PARAMS = Set.of("parseTime", "loc", "charset");

  public MySqlEngine() {
    super("mysql", "tidb", "mariadb");
  }

  @Override
  protected JdbcTarget translateNative(String dsn) {
    int slash = dsn.lastIndexOf('/');
    if (slash < 0) {
      throw new IllegalArgumentException("invalid mysql DSN, missing '/dbname'");
    }
    String head = dsn.substring(0, slash);
    String tail = dsn.substring(slash + 1);

    String user = null;
    String password = null;
    String address = head;
    int at = head.lastIndexOf('@');
    if (at >= 0) {
      String credentials = head.substring(0, at);
      address = head.substring(at + 1);
      int colon = credentials.indexOf(':');
      if (colon >= 0) {
        user = credentials.substring(0, colon);
        password = credentials.substring(colon + 1);
      } else {
        user = credentials;
      }
    }

    String hostPort = parseAddress(address);
    String database = tail;
    String query = "";
    int q = tail.indexOf('?');
    if (q >= 0) {
      database = tail.substring(0, q);
      query = filterParams(tail.substring(q + 1));
    }

    String url = "jdbc:mysql://" + hostPort + "/" + database + (query.isEmpty() ? "" : "?" + query);
    return new JdbcTarget(url, emptyToNull(user), password);
  }

  private static String parseAddress(String address) {
    if (address.isEmpty()) {
      return "localhost:3306";
    }
    int open = address.indexOf('(');
    String protocol = open < 0 ? address : address.substring(0, open);
    if (!protocol.equals("tcp")) {
      throw new IllegalArgumentException("unsupported mysql network: " + protocol);
    }
    if (open < 0) {
      return "localhost:3306";
    }
    int close = address.indexOf(')', open);
    if (close < 0) {
      throw new IllegalArgumentException("invalid mysql DSN, unterminated address");
    }
    String hostPort = address.substring(open + 1, close);
    if (hostPort.isEmpty()) {
      return "localhost:3306";
    }
    return hostPort.contains(":") ? hostPort : hostPort + ":3306";
  }

  private static String filterParams(String query) {
    List<String> kept = new ArrayList<>();
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq < 0 ? pair : pair.substring(0, eq);
      if (!DROPPED_PARAMS.contains(key)) {
        kept.add(pair);
      }
    }
    return String.join("&", kept);
  }

  private static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
