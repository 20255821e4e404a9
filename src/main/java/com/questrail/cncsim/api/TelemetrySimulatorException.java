package com.questrail.cncsim.api;

/**
 * Root of the unchecked exceptions raised by the simulator.
 */
public class TelemetrySimulatorException extends RuntimeException
{
    public TelemetrySimulatorException(String message) {
        super(message);
    }

    public TelemetrySimulatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
