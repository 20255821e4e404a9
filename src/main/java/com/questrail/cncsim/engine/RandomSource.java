package com.questrail.cncsim.engine;

/**
 * RandomSource
 * -----------------------------------------------------------------------------
 * Source of uniform draws owned by exactly one {@link MachineCycleEngine}.
 *
 * <p>Engines draw from this source for their per-machine baselines (once, at
 * construction) and for phase-duration and branch sampling (at each
 * transition). Tests substitute a scripted implementation to make the
 * sequence of phases reproducible.</p>
 */
public interface RandomSource
{
    /**
     * Uniform draw in {@code [0, 1)}.
     */
    double nextDouble();

    /**
     * Uniform 64-bit draw, used for seeding derived noise.
     */
    long nextLong();

    /**
     * Uniform draw in {@code [min, max)}.
     */
    default double uniform(double min, double max) {
        return min + nextDouble() * (max - min);
    }
}
