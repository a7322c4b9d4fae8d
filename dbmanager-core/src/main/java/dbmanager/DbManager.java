package dbmanager;

import dbmanager.health.HealthStatus;
import dbmanager.pool.PoolStats;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Connection management over one primary and a weighted set of replicas.
 *
 * <p>Obtained once at process start and shared by all threads. Data sources are keyed
 * {@code primary} and {@code replica_<index>} in every map this interface returns.
 *
 * <p>Once closed, every routing call and {@link #ping} throws {@link ConnectionException}.
 */
public interface DbManager extends AutoCloseable {

  /**
   * Client routing each statement on its own: writes and locking reads to the primary, other
   * reads to a weighted replica.
   */
  SqlClient routed();

  /**
   * Client bound to the primary for reads and writes.
   */
  SqlClient primary();

  /**
   * Client bound to one replica chosen by weight; the primary when no replica is configured.
   */
  SqlClient replica();

  /**
   * Runs {@code callback} in a transaction on the primary.
   *
   * <p>A throwing callback causes a rollback, after which its exception is rethrown unchanged.
   * A returning callback is committed and its value returned.
   *
   * @throws TransactionException if the callback is {@code null}, or begin or commit fails
   * @throws E                    whatever the callback throws
   */
  <T, E extends Exception> T runTransaction(TransactionCallback<T, E> callback) throws E;

  /**
   * Probes every data source now, installs the result as the current health snapshot and returns
   * it. Always contains an entry per data source, healthy or not.
   *
   * @param timeout deadline of each probe
   */
  Map<String, HealthStatus> checkHealth(Duration timeout);

  /**
   * Most recently installed health snapshot, empty before the first pass.
   */
  Map<String, HealthStatus> healthSnapshot();

  /**
   * Time of the most recent health pass, or {@code null} before the first one.
   */
  Instant lastHealthCheck();

  /**
   * Pool counters per data source, recomputed on each call.
   */
  Map<String, PoolStats> stats();

  /**
   * Checks primary liveness.
   *
   * @throws ConnectionException if the primary cannot be reached within {@code timeout}
   */
  void ping(Duration timeout);

  /**
   * Stops monitoring, waits for it to finish, then closes every data source. Idempotent.
   *
   * @throws ConnectionException if a data source failed to close; the others are still closed
   */
  @Override
  void close();
}
