package dbmanager;

/**
 * Unit of work run inside a transaction on the primary.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 * @see DbManager#runTransaction(TransactionCallback)
 */
@FunctionalInterface
public interface TransactionCallback<T, E extends Exception> {

  /**
   * @param tx client bound to the transaction's connection
   * @return the value handed back to the caller after commit
   */
  T doInTransaction(SqlClient tx) throws E;
}
