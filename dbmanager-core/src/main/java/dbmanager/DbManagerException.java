package dbmanager;

/**
 * Base class of every exception raised by the manager. All subclasses are unchecked.
 */
public class DbManagerException extends RuntimeException {
  public DbManagerException(String message) {
    super(message);
  }

  public DbManagerException(String message, Throwable cause) {
    super(message, cause);
  }
}
