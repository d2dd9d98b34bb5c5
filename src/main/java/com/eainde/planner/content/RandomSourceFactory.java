package com.eainde.planner.content;

import java.util.function.LongFunction;

/**
 * Hands out an independent {@link RandomSource} per day, derived from the run seed,
 * so the week is reproducible whether days run sequentially or in parallel.
 */
public class RandomSourceFactory {

    private final long seed;
    private final LongFunction<RandomSource> sourceForSeed;

    public RandomSourceFactory(long seed) {
        this(seed, SeededRandomSource::new);
    }

    public RandomSourceFactory(long seed, LongFunction<RandomSource> sourceForSeed) {
        this.seed = seed;
        this.sourceForSeed = sourceForSeed;
    }

    public RandomSource forDay(int day) {
        return sourceForSeed.apply(seed + day);
    }

    public long getSeed() {
        return seed;
    }
}
