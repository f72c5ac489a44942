package com.di.querybench.load.generator;

import java.util.Arrays;
import java.util.Random;

/** Draws distinct positions out of a small population. */
final class DistinctSampler {

    private DistinctSampler() {}

    /**
     * Returns {@code k} distinct positions from {@code [0, population)} in draw order
     * (partial Fisher-Yates shuffle).
     */
    static int[] sample(int population, int k, Random random) {
        if (k < 0 || k > population) {
            throw new IllegalArgumentException("cannot draw " + k + " distinct values from " + population);
        }
        int[] pool = new int[population];
        for (int i = 0; i < population; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(population - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        return Arrays.copyOf(pool, k);
    }

    /** Uniform count in {@code [1, min(max, population)]}. */
    static int membershipCount(int max, int population, Random random) {
        int upper = Math.min(max, population);
        return 1 + random.nextInt(upper);
    }
}
