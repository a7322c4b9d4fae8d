/**
 * Database engines and DSN translation: MySQL ({@code user:pass@tcp(host:port)/db}),
 * PostgreSQL (URL or {@code key=value}), SQLite (file path) and H2.
 *
 * @see dbmanager.jdbc.engine.Engines
 */
package dbmanager.jdbc.engine;
