package com.questrail.cncsim.engine;

import java.time.Duration;

/**
 * Closed range of phase durations in whole seconds from which a planned
 * duration is drawn uniformly.
 */
public record DurationRange(long minSeconds, long maxSeconds)
{
    public DurationRange {
        if (minSeconds < 0 || maxSeconds < minSeconds) {
            throw new IllegalArgumentException("invalid range [" + minSeconds + "," + maxSeconds + "]");
        }
    }

    public static DurationRange ofSeconds(long minSeconds, long maxSeconds) {
        return new DurationRange(minSeconds, maxSeconds);
    }

    /**
     * Draws a duration in {@code [min, max]} with millisecond resolution.
     */
    public Duration sample(RandomSource random) {
        double seconds = random.uniform(minSeconds, maxSeconds);
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    public boolean contains(Duration duration) {
        return duration.compareTo(Duration.ofSeconds(minSeconds)) >= 0
                && duration.compareTo(Duration.ofSeconds(maxSeconds)) <= 0;
    }
}
