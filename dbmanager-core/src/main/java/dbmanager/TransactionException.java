package dbmanager;

/**
 * Infrastructure failure around a transaction: missing callback, begin failure or commit
 * failure. Failures raised by the callback itself are never wrapped in this type.
 */
public final class TransactionException extends DbManagerException {
  public TransactionException(String message) {
    super(message);
  }

  public TransactionException(String message, Throwable cause) {
    super(message, cause);
  }
}
