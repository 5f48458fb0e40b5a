package com.yerin.retry.infra;

import java.util.SplittableRandom;

/**
 * Deterministic source: two instances built from the same seed yield the same sequence.
 */
public final class SeededRandomSource implements RandomSource {
    private final long seed;
    private final SplittableRandom random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public synchronized long nextLong(long min, long max) {
        return InclusiveRange.pick(random, min, max);
    }
}
