package com.questrail.cncsim.engine;

import com.questrail.cncsim.api.CyclePhase;

import java.time.Duration;
import java.time.Instant;

/**
 * Record of one phase change performed during a tick.
 */
public record PhaseTransition(
        String machineId,
        CyclePhase from,
        CyclePhase to,
        Instant at,
        Duration plannedDuration
) {
}
