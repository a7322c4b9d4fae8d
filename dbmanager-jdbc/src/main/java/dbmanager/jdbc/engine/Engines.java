package dbmanager.jdbc.engine;

import dbmanager.jdbc.spi.Engine;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of database engines.
 *
 * <p>Engines are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/dbmanager.jdbc.spi.Engine}.
 *
 * <pre>{@code
 * Engine engine = Engines.get("postgresql");
 * JdbcTarget target = engine.translate("host=db user=app password=secret dbname=app");
 * }</pre>
 */
public final class Engines {

  private static final List<Engine> ENGINES;
  private static final Map<String, Engine> BY_NAME = new ConcurrentHashMap<>();

  static {
    ENGINES = ServiceLoader.load(Engine.class, Engines.class.getClassLoader())
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (Engine engine : ENGINES) {
      BY_NAME.put(engine.name().toLowerCase(Locale.ROOT), engine);
      for (String alias : engine.aliases()) {
        BY_NAME.putIfAbsent(alias.toLowerCase(Locale.ROOT), engine);
      }
    }
  }

  private Engines() {
  }

  /**
   * Returns all registered engines.
   */
  public static List<Engine> all() {
    return ENGINES;
  }

  /**
   * Gets an engine by name or alias.
   *
   * @param type engine type (case-insensitive)
   * @return the engine
   * @throws IllegalArgumentException if no engine is registered under that type
   */
  public static Engine get(String type) {
    Engine engine = type == null ? null : BY_NAME.get(type.toLowerCase(Locale.ROOT));
    if (engine == null) {
      throw new IllegalArgumentException("unsupported database type: " + type
          + ". Available: " + new TreeMap<>(BY_NAME).keySet());
    }
    return engine;
  }
}
