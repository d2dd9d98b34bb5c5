package com.eainde.planner.content;

import java.util.Random;

/**
 * {@link RandomSource} over {@link Random}. Not thread-safe; use one instance per day.
 */
public class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int nextIndex(int bound) {
        return random.nextInt(bound);
    }
}
