package dbmanager;

/**
 * The pool shape could not be applied to an opened handle.
 */
public final class PoolException extends DbManagerException {
  public PoolException(String message) {
    super(message);
  }

  public PoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
