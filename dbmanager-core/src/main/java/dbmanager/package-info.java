/**
 * Database connection manager: one primary and weighted read replicas behind a single
 * {@link dbmanager.DbManager}.
 *
 * <p>The manager routes statements, shapes connection pools, monitors health in the background
 * and runs transactions that roll back on every exit path. All failures are unchecked and
 * extend {@link dbmanager.DbManagerException}.
 *
 * @see dbmanager.DbManager
 * @see dbmanager.SqlClient
 * @see dbmanager.config.DbManagerConfig
 */
package dbmanager;
