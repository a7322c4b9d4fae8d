package dbmanager;

/**
 * A data source could not be opened, reached, or closed.
 */
public final class ConnectionException extends DbManagerException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
