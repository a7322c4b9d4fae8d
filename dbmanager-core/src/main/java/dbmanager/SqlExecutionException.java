package dbmanager;

/**
 * Unchecked exception wrapping JDBC errors thrown while a {@link SqlClient} executes a statement.
 */
public final class SqlExecutionException extends DbManagerException {
  public SqlExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
