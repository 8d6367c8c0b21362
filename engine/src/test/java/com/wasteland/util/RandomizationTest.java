package com.wasteland.util;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for Randomization utility class.
 */
public class RandomizationTest {

    private static final int SAMPLE_SIZE = 20000;

    private Randomization randomization;

    @Before
    public void setUp() {
        // Use seeded randomization for reproducible tests
        randomization = new Randomization(12345L);
    }

    // ========================================================================
    // Uniform Distribution Tests
    // ========================================================================

    @Test
    public void testNextUnit_InRange() {
        for (int i = 0; i < SAMPLE_SIZE; i++) {
            double value = randomization.nextUnit();
            assertTrue("Value should be >= 0", value >= 0.0);
            assertTrue("Value should be < 1", value < 1.0);
        }
    }

    @Test
    public void testSeededInstances_ProduceSameSequence() {
        Randomization other = new Randomization(12345L);
        for (int i = 0; i < 100; i++) {
            assertEquals(randomization.nextUnit(), other.nextUnit(), 0.0);
        }
    }

    // ========================================================================
    // Weighted Selection Tests
    // ========================================================================

    @Test
    public void testWeightedChoice_MatchesWeights() {
        double[] weights = {50, 30, 15, 5};
        int[] counts = new int[weights.length];
        for (int i = 0; i < SAMPLE_SIZE; i++) {
            counts[randomization.weightedChoice(weights)]++;
        }

        assertEquals(0.50, counts[0] / (double) SAMPLE_SIZE, 0.02);
        assertEquals(0.30, counts[1] / (double) SAMPLE_SIZE, 0.02);
        assertEquals(0.15, counts[2] / (double) SAMPLE_SIZE, 0.02);
        assertEquals(0.05, counts[3] / (double) SAMPLE_SIZE, 0.01);
    }

    @Test
    public void testWeightedChoice_ZeroWeightNeverChosen() {
        double[] weights = {0, 1, 0};
        for (int i = 0; i < 1000; i++) {
            assertEquals(1, randomization.weightedChoice(weights));
        }
    }

    @Test
    public void testWeightedChoice_EmptyOrAllZero_ReturnsMinusOne() {
        assertEquals(-1, randomization.weightedChoice(new double[0]));
        assertEquals(-1, randomization.weightedChoice(new double[]{0, 0}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWeightedChoice_NegativeWeight_Throws() {
        randomization.weightedChoice(new double[]{1, -1});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWeightedChoice_Null_Throws() {
        randomization.weightedChoice(null);
    }
}
