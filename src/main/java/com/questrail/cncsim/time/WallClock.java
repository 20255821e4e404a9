package com.questrail.cncsim.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Absolute time source used to stamp sensor readings and to drive the phase
 * timers of each machine.
 *
 * <p>This clock may jump (NTP, manual adjustment). Consumers that require
 * ordering, such as {@code MachineCycleEngine}, clamp values that move
 * backwards instead of trusting the clock.</p>
 */
public interface WallClock
{
    Instant now();
}
