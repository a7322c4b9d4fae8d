/**
 * JDBC transaction management.
 *
 * <p>{@link dbmanager.jdbc.tx.TransactionExecutor} commits when the callback returns and rolls
 * back on any throwable.
 */
package dbmanager.jdbc.tx;
