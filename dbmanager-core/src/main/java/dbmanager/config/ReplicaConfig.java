package dbmanager.config;

/**
 * Read replica descriptor.
 *
 * @param dsn    data-source descriptor
 * @param type   engine type; empty or {@code null} inherits the primary's type
 * @param weight relative selection probability; {@code 0} means never selected
 * @param pool   replica-specific pool shape; unset falls back to the global shape
 */
public record ReplicaConfig(String dsn, String type, int weight, PoolConfig pool) {

  public ReplicaConfig {
    pool = pool == null ? PoolConfig.DEFAULT : pool;
  }

  public static ReplicaConfig of(String dsn, String type, int weight) {
    return new ReplicaConfig(dsn, type, weight, PoolConfig.DEFAULT);
  }

  /**
   * Resolves the descriptor this replica is opened with.
   *
   * @param primaryType engine type used when this replica declares none
   */
  public DataSourceConfig toDataSource(String primaryType) {
    return new DataSourceConfig(dsn, type == null || type.isEmpty() ? primaryType : type);
  }

  /**
   * Pool shape in effect for this replica.
   */
  public PoolConfig effectivePool(PoolConfig global) {
    return pool.isUnset() ? global : pool;
  }
}
