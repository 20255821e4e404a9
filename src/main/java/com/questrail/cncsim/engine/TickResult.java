package com.questrail.cncsim.engine;

import com.questrail.cncsim.api.SensorReading;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one {@link MachineCycleEngine#tick} call.
 *
 * @param readings   readings synthesized after the state was advanced
 * @param transition the phase change performed by this tick, if any
 */
public record TickResult(List<SensorReading> readings, Optional<PhaseTransition> transition)
{
    public TickResult {
        readings = List.copyOf(readings);
    }
}
