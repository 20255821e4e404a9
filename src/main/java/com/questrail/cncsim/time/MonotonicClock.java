package com.questrail.cncsim.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for anything measured as a span: tick deadlines, uptime and
 * messages-per-second.
 *
 * <h2>Binding invariant</h2>
 * Tick cadence and uptime MUST be derived from this clock. The wall clock
 * ({@link WallClock}) is reserved for reading timestamps, which end up on the
 * wire and therefore have to be absolute.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing value in nanoseconds. Only
     * differences between two values are meaningful.
     */
    long nowNanos();
}
