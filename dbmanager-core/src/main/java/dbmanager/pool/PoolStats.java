package dbmanager.pool;

import java.time.Duration;

/**
 * Read-only snapshot of one data source's pool counters.
 *
 * @param openConnections   physical connections currently open, idle or in use
 * @param inUse             connections currently borrowed
 * @param idle              connections currently idle
 * @param waitCount         cumulative number of borrows that had to wait for a connection
 * @param waitDuration      cumulative time spent waiting by those borrows
 * @param maxIdleClosed     connections closed because the pool shrank towards its idle target
 * @param maxIdleTimeClosed connections closed for exceeding the maximum idle time
 * @param maxLifetimeClosed connections closed for exceeding the maximum lifetime
 */
public record PoolStats(
    int openConnections,
    int inUse,
    int idle,
    long waitCount,
    Duration waitDuration,
    long maxIdleClosed,
    long maxIdleTimeClosed,
    long maxLifetimeClosed
) {
  public static final PoolStats EMPTY = new PoolStats(0, 0, 0, 0, Duration.ZERO, 0, 0, 0);
}
