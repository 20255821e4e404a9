package com.questrail.cncsim.runtime;

import com.questrail.cncsim.api.TelemetrySimulatorException;

/**
 * Raised by operations that need a running simulation, such as
 * {@link SimulationScheduler#runTick()}.
 */
public final class SimulationNotRunningException extends TelemetrySimulatorException
{
    public SimulationNotRunningException(String message) {
        super(message);
    }
}
