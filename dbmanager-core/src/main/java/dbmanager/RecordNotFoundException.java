package dbmanager;

/**
 * Thrown by {@link SqlClient#queryOne} when the query produced no row.
 *
 * <p>Statement traces failing with this exception can be logged as plain executions,
 * see {@link dbmanager.config.LogConfig#ignoreRecordNotFoundError()}.
 */
public final class RecordNotFoundException extends DbManagerException {
  public RecordNotFoundException(String message) {
    super(message);
  }
}
