package dbmanager.routing;

import java.util.List;
import java.util.Objects;

/**
 * Decides which handle serves an operation: the primary for writes, a replica chosen by a
 * {@link ReplicaPolicy} for reads.
 *
 * <p>Immutable. Routing is an in-memory decision and never touches a live connection.
 *
 * @param <H> handle type
 */
public final class ConnectionRouter<H> {
  private final H primary;
  private final List<H> replicas;
  private final int[] weights;
  private final ReplicaPolicy policy;

  /**
   * @param primary  the write target
   * @param replicas read targets in configuration order
   * @param weights  one weight per replica
   * @param policy   replica selection policy
   */
  public ConnectionRouter(H primary, List<H> replicas, int[] weights, ReplicaPolicy policy) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.replicas = List.copyOf(replicas);
    this.weights = weights.clone();
    this.policy = Objects.requireNonNull(policy, "policy");
    if (this.replicas.size() != this.weights.length) {
      throw new IllegalArgumentException("one weight per replica required: "
          + this.replicas.size() + " replicas, " + this.weights.length + " weights");
    }
  }

  /** Always the primary. */
  public H routeForWrite() {
    return primary;
  }

  /**
   * A replica chosen by the policy; the primary when no replica is configured or none can be
   * chosen.
   */
  public H routeForRead() {
    if (replicas.isEmpty()) {
      return primary;
    }
    int index = policy.choose(weights);
    return index < 0 || index >= replicas.size() ? primary : replicas.get(index);
  }

  /**
   * Routes one statement: reads to {@link #routeForRead()}, everything else to the primary.
   */
  public H route(StatementKind kind) {
    return kind == StatementKind.READ ? routeForRead() : routeForWrite();
  }

  public List<H> replicas() {
    return replicas;
  }

  public boolean hasReplicas() {
    return !replicas.isEmpty();
  }
}
