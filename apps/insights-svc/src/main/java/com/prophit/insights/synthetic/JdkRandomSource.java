package com.prophit.insights.synthetic;

import java.util.Objects;
import java.util.Random;

final class JdkRandomSource implements RandomSource {

    private final Random random;

    JdkRandomSource(Random random) {
        this.random = Objects.requireNonNull(random, "random must be provided");
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
