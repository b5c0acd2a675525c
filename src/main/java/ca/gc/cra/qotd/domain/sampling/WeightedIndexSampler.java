package ca.gc.cra.qotd.domain.sampling;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Samples indices {@code 0..n-1} with probability proportional to integer weights.
 *
 * <p>Uses Vose's alias method: construction is {@code O(n)} and every draw costs one bounded integer
 * and one double from the supplied random source. Instances are immutable after construction and
 * safe to share; the random source passed to {@link #sample(RandomGenerator)} is not.</p>
 *
 * @since 0.1.0
 */
public final class WeightedIndexSampler {
  private final double[] probability;
  private final int[] alias;
  private final long totalWeight;

  private WeightedIndexSampler(double[] probability, int[] alias, long totalWeight) {
    this.probability = probability;
    this.alias = alias;
    this.totalWeight = totalWeight;
  }

  /**
   * Builds a sampler over the given weights.
   *
   * @param weights non-negative weights, one per index; must not be {@code null}
   * @return immutable sampler
   * @throws IllegalArgumentException if there are no weights, any weight is negative, or all weights are zero
   */
  public static WeightedIndexSampler of(int[] weights) {
    Objects.requireNonNull(weights, "weights");
    int n = weights.length;
    if (n == 0) {
      throw new IllegalArgumentException("weights must not be empty");
    }
    long total = 0;
    for (int i = 0; i < n; i++) {
      if (weights[i] < 0) {
        throw new IllegalArgumentException("weight " + i + " must not be negative (was " + weights[i] + ")");
      }
      total += weights[i];
    }
    if (total == 0) {
      throw new IllegalArgumentException("at least one weight must be positive");
    }

    double[] scaled = new double[n];
    for (int i = 0; i < n; i++) {
      scaled[i] = (double) weights[i] * n / total;
    }

    double[] probability = new double[n];
    int[] alias = new int[n];
    int[] small = new int[n];
    int[] large = new int[n];
    int smallCount = 0;
    int largeCount = 0;
    for (int i = 0; i < n; i++) {
      if (scaled[i] < 1.0d) {
        small[smallCount++] = i;
      } else {
        large[largeCount++] = i;
      }
    }

    while (smallCount > 0 && largeCount > 0) {
      int less = small[--smallCount];
      int more = large[--largeCount];
      probability[less] = scaled[less];
      alias[less] = more;
      scaled[more] = (scaled[more] + scaled[less]) - 1.0d;
      if (scaled[more] < 1.0d) {
        small[smallCount++] = more;
      } else {
        large[largeCount++] = more;
      }
    }
    // Leftovers are 1.0 up to rounding error.
    while (largeCount > 0) {
      int index = large[--largeCount];
      probability[index] = 1.0d;
      alias[index] = index;
    }
    while (smallCount > 0) {
      int index = small[--smallCount];
      probability[index] = 1.0d;
      alias[index] = index;
    }
    return new WeightedIndexSampler(probability, alias, total);
  }

  /**
   * Draws one index.
   *
   * @param random random source; must not be {@code null}
   * @return index in {@code [0, size())}; zero-weight indices are never returned
   */
  public int sample(RandomGenerator random) {
    int column = random.nextInt(probability.length);
    return random.nextDouble() < probability[column] ? column : alias[column];
  }

  /**
   * Returns the number of weighted indices.
   *
   * @return index count
   */
  public int size() {
    return probability.length;
  }

  /**
   * Returns the sum of all weights.
   *
   * @return total weight
   */
  public long totalWeight() {
    return totalWeight;
  }

  @Override
  public String toString() {
    return "WeightedIndexSampler{size=" + probability.length
        + ", totalWeight=" + totalWeight + '}';
  }
}
