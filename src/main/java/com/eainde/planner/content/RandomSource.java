package com.eainde.planner.content;

import java.util.List;

/**
 * Source of template choices. Implementations must be reproducible for a fixed seed.
 */
public interface RandomSource {

    /** Uniform index in {@code [0, bound)}. */
    int nextIndex(int bound);

    default <T> T pick(List<T> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return options.get(nextIndex(options.size()));
    }
}
