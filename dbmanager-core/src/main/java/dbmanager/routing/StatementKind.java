package dbmanager.routing;

/**
 * Routing class of a statement.
 */
public enum StatementKind {
  /** Plain read, may be served by a replica. */
  READ,
  /** Data modification or locking read, served by the primary. */
  WRITE,
  /** Schema change or other command, served by the primary. */
  DDL
}
