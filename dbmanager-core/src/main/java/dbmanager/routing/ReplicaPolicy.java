package dbmanager.routing;

/**
 * Chooses which replica serves a read.
 *
 * @see WeightedRandomPolicy
 */
@FunctionalInterface
public interface ReplicaPolicy {

  /**
   * Picks a replica index.
   *
   * @param weights configured weights, one per replica, all &ge; 0
   * @return the chosen index, or {@code -1} if no replica can be chosen
   */
  int choose(int[] weights);
}
