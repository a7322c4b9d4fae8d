package dbmanager.jdbc.engine;

/**
 * H2 engine. The DSN is anything H2 accepts after {@code jdbc:h2:}, e.g. {@code mem:app} or
 * {@code ./data/app}.
 */
public final class H2Engine extends AbstractEngine {

  public H2Engine() {
    super("h2");
  }

  @Override
  protected JdbcTarget translateNative(String dsn) {
    return JdbcTarget.of("jdbc:h2:" + dsn);
  }
}
