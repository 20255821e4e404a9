package com.questrail.cncsim.engine;

import java.util.SplittableRandom;

/**
 * {@link RandomSource} backed by {@link SplittableRandom}.
 *
 * <p>Not thread-safe; each engine owns its own instance, which matches the
 * single-writer rule for engine state.</p>
 */
public final class SplittableRandomSource implements RandomSource {

    private final SplittableRandom random;

    public SplittableRandomSource(long seed) {
        this.random = new SplittableRandom(seed);
    }

    public SplittableRandomSource() {
        this.random = new SplittableRandom();
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }

    @Override
    public long nextLong() {
        return random.nextLong();
    }
}
