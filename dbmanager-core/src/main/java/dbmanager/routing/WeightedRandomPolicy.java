package dbmanager.routing;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Picks a replica with probability proportional to its weight. A weight of zero is never
 * picked; if every weight is zero no replica is picked.
 */
public final class WeightedRandomPolicy implements ReplicaPolicy {
  private final LongUnaryOperator nextLong;

  /**
   * Uses {@link ThreadLocalRandom}; safe for concurrent callers.
   */
  public WeightedRandomPolicy() {
    this.nextLong = bound -> ThreadLocalRandom.current().nextLong(bound);
  }

  /**
   * Uses the given source of randomness, e.g. a seeded {@link Random} in tests.
   */
  public WeightedRandomPolicy(Random random) {
    Objects.requireNonNull(random, "random");
    this.nextLong = random::nextLong;
  }

  @Override
  public int choose(int[] weights) {
    long total = 0;
    for (int weight : weights) {
      total += Math.max(0, weight);
    }
    if (total <= 0) {
      return -1;
    }
    // the sum of int weights can exceed Integer.MAX_VALUE
    long point = nextLong.applyAsLong(total);
    for (int i = 0; i < weights.length; i++) {
      long weight = Math.max(0, weights[i]);
      if (point < weight) {
        return i;
      }
      point -= weight;
    }
    return -1;
  }
}
