package com.questrail.cncsim.engine;

import java.time.Duration;

/**
 * Planned-duration ranges for each phase and the branch probabilities taken
 * when a machine finishes unloading.
 */
public final class PhaseDurations
{
    public static final DurationRange IDLE = DurationRange.ofSeconds(60, 360);
    public static final DurationRange LOADING = DurationRange.ofSeconds(30, 150);
    public static final DurationRange MACHINING = DurationRange.ofSeconds(600, 2400);
    public static final DurationRange UNLOADING = DurationRange.ofSeconds(15, 75);
    public static final DurationRange MAINTENANCE = DurationRange.ofSeconds(900, 4500);
    public static final DurationRange ERROR = DurationRange.ofSeconds(300, 900);

    /** Fixed window for machines classified as under maintenance at startup. */
    public static final Duration INITIAL_MAINTENANCE = Duration.ofHours(1);

    /** Draws below this go to ERROR after unloading. */
    public static final double ERROR_BRANCH_BELOW = 0.05;

    /** Draws below this (and not below {@link #ERROR_BRANCH_BELOW}) go to MAINTENANCE. */
    public static final double MAINTENANCE_BRANCH_BELOW = 0.15;

    private PhaseDurations() {}
}
