package com.questrail.cncsim.runtime;

import com.questrail.cncsim.api.TelemetrySimulatorException;

/**
 * Raised by {@link SimulationScheduler#start()} when the simulation is
 * already running.
 */
public final class SimulationAlreadyRunningException extends TelemetrySimulatorException
{
    public SimulationAlreadyRunningException(String message) {
        super(message);
    }
}
