package dbmanager.jdbc.engine;

import dbmanager.jdbc.spi.Engine;

import java.util.List;

/**
 * Base class for engines: passes {@code jdbc:} URLs through, translates native DSNs otherwise.
 */
public abstract class AbstractEngine implements Engine {
  private final String name;
  private final List<String> aliases;

  protected AbstractEngine(String name, String... aliases) {
    this.name = name;
    this.aliases = List.of(aliases);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<String> aliases() {
    return aliases;
  }

  @Override
  public JdbcTarget translate(String dsn) {
    if (dsn == null || dsn.isEmpty()) {
      throw new IllegalArgumentException("DSN cannot be empty");
    }
    if (dsn.startsWith("jdbc:")) {
      return JdbcTarget.of(dsn);
    }
    return translateNative(dsn);
  }

  /**
   * Translates the engine's own DSN syntax.
   */
  protected abstract JdbcTarget translateNative(String dsn);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + "]";
  }
}
