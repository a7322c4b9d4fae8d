/**
 * JDBC implementation of {@link dbmanager.DbManager} over HikariCP pools.
 *
 * <p>{@link dbmanager.jdbc.JdbcDbManager} wires the engine registry, the pooled data sources,
 * the SQL clients and the transaction executor.
 *
 * @see dbmanager.jdbc.JdbcDbManager
 * @see dbmanager.jdbc.engine.Engines
 * @see dbmanager.jdbc.pool.HikariDataSourceDriver
 */
package dbmanager.jdbc;
