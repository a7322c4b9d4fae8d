package dbmanager;

/**
 * Thrown when a configuration is rejected by {@link dbmanager.config.ConfigValidator}.
 * Raised before any connection is opened.
 */
public final class ConfigException extends DbManagerException {
  public ConfigException(String message) {
    super(message);
  }
}
