package com.prophit.insights.synthetic;

import java.util.List;
import java.util.Random;

/**
 * Source of randomness for synthetic data. Seeded instances make generation reproducible.
 */
public interface RandomSource {

    /** Uniform value in [0, 1). */
    double nextDouble();

    /** Uniform value in [0, bound). */
    int nextInt(int bound);

    default double uniform(double min, double max) {
        return min + nextDouble() * (max - min);
    }

    default boolean chance(double probability) {
        return nextDouble() < probability;
    }

    default <T> T pick(List<T> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("cannot pick from an empty list");
        }
        return values.get(nextInt(values.size()));
    }

    static RandomSource seeded(long seed) {
        return new JdkRandomSource(new Random(seed));
    }

    static RandomSource entropy() {
        return new JdkRandomSource(new Random());
    }
}
