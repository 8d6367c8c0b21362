package com.wasteland.util;

import javax.inject.Singleton;
import java.util.Random;

/**
 * Random draws used by loot and encounter resolution.
 *
 * <p>All draws go through this class so tests can seed it or replace it with a mock
 * to force specific outcomes.
 */
@Singleton
public class Randomization {

    private final Random random;

    public Randomization() {
        this.random = new Random();
    }

    /**
     * Constructor with seeded random for deterministic testing.
     *
     * @param seed the random seed
     */
    public Randomization(long seed) {
        this.random = new Random(seed);
    }

    // ========================================================================
    // Uniform Distribution
    // ========================================================================

    /**
     * Generate a random double uniformly distributed in [0, 1).
     *
     * @return a random double in [0, 1)
     */
    public double nextUnit() {
        return random.nextDouble();
    }

    // ========================================================================
    // Weighted Selection
    // ========================================================================

    /**
     * Select an index by walking partial sums of the weights.
     *
     * <p>A value {@code r} is drawn in [0, total). Each weight is subtracted from {@code r}
     * in array order and the first index where {@code r} drops to zero or below is chosen.
     * Weights do not need to sum to 1.0.
     *
     * @param weights weights for each index, none negative
     * @return the selected index, or -1 if the array is empty or every weight is zero
     */
    public int weightedChoice(double[] weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Weights array cannot be null");
        }

        double totalWeight = 0;
        for (double w : weights) {
            if (w < 0) {
                throw new IllegalArgumentException("Weights cannot be negative");
            }
            totalWeight += w;
        }

        if (totalWeight <= 0) {
            return -1;
        }

        double remaining = nextUnit() * totalWeight;
        for (int i = 0; i < weights.length; i++) {
            remaining -= weights[i];
            if (remaining <= 0) {
                return i;
            }
        }

        // Rounding can leave a sliver above zero after the last entry
        return weights.length - 1;
    }
}
