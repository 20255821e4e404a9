package com.questrail.cncsim.engine;

import com.questrail.cncsim.api.CyclePhase;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * CycleState
 * -----------------------------------------------------------------------------
 * Immutable description of the phase a machine is currently in.
 *
 * <p>The owning {@link MachineCycleEngine} replaces the whole value on every
 * transition; there is no partial mutation. Time-dependent views take
 * {@code now} explicitly so the same state can be evaluated at any instant.</p>
 */
public final class CycleState
{
    /** Planned duration of a phase that never ends. */
    public static final Duration UNBOUNDED = Duration.ofSeconds(Long.MAX_VALUE);

    /** Number of tools cycled through during one machining phase. */
    public static final int TOOLS_PER_CYCLE = 5;

    private final CyclePhase phase;
    private final Instant startTime;
    private final Duration plannedDuration;

    public CycleState(CyclePhase phase, Instant startTime, Duration plannedDuration) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.plannedDuration = Objects.requireNonNull(plannedDuration, "plannedDuration");
        if (plannedDuration.isNegative()) {
            throw new IllegalArgumentException("plannedDuration must be >= 0");
        }
    }

    public static CycleState unbounded(CyclePhase phase, Instant startTime) {
        return new CycleState(phase, startTime, UNBOUNDED);
    }

    public CyclePhase phase() {
        return phase;
    }

    public Instant startTime() {
        return startTime;
    }

    public Duration plannedDuration() {
        return plannedDuration;
    }

    public boolean isUnbounded() {
        return plannedDuration.equals(UNBOUNDED);
    }

    /**
     * Instant at which the phase is planned to end, or {@code null} when unbounded.
     */
    public Instant plannedEnd() {
        return isUnbounded() ? null : startTime.plus(plannedDuration);
    }

    /**
     * Time spent in this phase at {@code now}; never negative.
     */
    public Duration elapsed(Instant now) {
        Duration d = Duration.between(startTime, now);
        return d.isNegative() ? Duration.ZERO : d;
    }

    public double elapsedSeconds(Instant now) {
        return elapsed(now).toMillis() / 1000.0;
    }

    public double plannedSeconds() {
        return isUnbounded() ? Double.POSITIVE_INFINITY : plannedDuration.toMillis() / 1000.0;
    }

    /**
     * Whether the planned duration has been reached at {@code now}.
     */
    public boolean isComplete(Instant now) {
        return !isUnbounded() && elapsed(now).compareTo(plannedDuration) >= 0;
    }

    /**
     * Fraction of the planned duration that has elapsed, clamped to
     * {@code [0, 0.999]}. Unbounded and zero-length phases report 0.
     */
    public double progressFraction(Instant now) {
        double planned = plannedSeconds();
        if (isUnbounded() || planned <= 0) {
            return 0.0;
        }
        double fraction = elapsedSeconds(now) / planned;
        return Math.max(0.0, Math.min(0.999, fraction));
    }

    /**
     * Tool in the spindle at {@code now}. Machining walks through tools
     * 1..{@value #TOOLS_PER_CYCLE} as the phase progresses; every other phase
     * reports tool 1.
     */
    public int currentTool(Instant now) {
        if (phase != CyclePhase.MACHINING) {
            return 1;
        }
        return (int) Math.floor(progressFraction(now) * TOOLS_PER_CYCLE) + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CycleState other)) return false;
        return phase == other.phase
                && startTime.equals(other.startTime)
                && plannedDuration.equals(other.plannedDuration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, startTime, plannedDuration);
    }

    @Override
    public String toString() {
        return "CycleState{" + phase + ", start=" + startTime
                + ", planned=" + (isUnbounded() ? "unbounded" : plannedDuration) + '}';
    }
}
