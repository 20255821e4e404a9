package com.questrail.cncsim.synthesis;

import java.time.Instant;
import java.util.SplittableRandom;

/**
 * Stateless pseudo-random noise keyed by machine seed, sensor channel and
 * instant.
 *
 * <p>The same triple always yields the same value, which is what keeps
 * {@link SensorSynthesizer} a pure function while still producing readings
 * that look random tick over tick.</p>
 */
public final class DeterministicNoise
{
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private DeterministicNoise() {
    }

    /**
     * Uniform value in {@code [0, 1)}.
     */
    public static double uniform(long seed, String channel, Instant at) {
        long mixed = seed;
        mixed = mixed * GOLDEN_GAMMA + channel.hashCode();
        mixed = mixed * GOLDEN_GAMMA + at.toEpochMilli();
        return new SplittableRandom(mixed).nextDouble();
    }

    /**
     * Uniform value in {@code [min, max)}.
     */
    public static double uniform(long seed, String channel, Instant at, double min, double max) {
        return min + uniform(seed, channel, at) * (max - min);
    }

    /**
     * {@code sin(2π t / period)} where {@code t} is the wall-clock time of
     * {@code at} in seconds, optionally shifted by {@code phaseOffset} radians.
     */
    public static double oscillation(Instant at, double periodSeconds, double phaseOffset) {
        double t = at.toEpochMilli() / 1000.0;
        return Math.sin(2.0 * Math.PI * t / periodSeconds + phaseOffset);
    }

    public static double oscillation(Instant at, double periodSeconds) {
        return oscillation(at, periodSeconds, 0.0);
    }
}
