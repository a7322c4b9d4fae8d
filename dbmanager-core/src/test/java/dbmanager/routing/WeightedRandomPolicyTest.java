package dbmanager.routing;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WeightedRandomPolicyTest {

  @Test
  void selectionConvergesToWeights() {
    WeightedRandomPolicy policy = new WeightedRandomPolicy(new Random(42));
    int[] weights = {1, 3, 6};
    int[] counts = new int[weights.length];
    int draws = 10_000;

    for (int i = 0; i < draws; i++) {
      counts[policy.choose(weights)]++;
    }

    for (int i = 0; i < weights.length; i++) {
      double expected = draws * weights[i] / 10.0;
      assertEquals(expected, counts[i], expected * 0.1, "replica " + i);
    }
  }

  @Test
  void zeroWeightIsNeverChosen() {
    WeightedRandomPolicy policy = new WeightedRandomPolicy(new Random(7));
    int[] weights = {0, 5, 0};
    for (int i = 0; i < 1_000; i++) {
      assertEquals(1, policy.choose(weights));
    }
  }

  @Test
  void allZeroChoosesNothing() {
    assertEquals(-1, new WeightedRandomPolicy().choose(new int[] {0, 0}));
    assertEquals(-1, new WeightedRandomPolicy().choose(new int[0]));
  }

  @Test
  void weightsSummingPastIntRangeStayProportional() {
    WeightedRandomPolicy policy = new WeightedRandomPolicy(new Random(11));
    int[] weights = {Integer.MAX_VALUE, Integer.MAX_VALUE};
    int[] counts = new int[2];
    int draws = 10_000;

    for (int i = 0; i < draws; i++) {
      counts[policy.choose(weights)]++;
    }

    assertEquals(draws / 2.0, counts[0], draws * 0.05);
    assertEquals(draws / 2.0, counts[1], draws * 0.05);
  }
}
