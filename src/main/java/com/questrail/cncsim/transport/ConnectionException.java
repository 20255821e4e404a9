package com.questrail.cncsim.transport;

import com.questrail.cncsim.api.TelemetrySimulatorException;

/**
 * Indicates that a sink could not establish its connection to the
 * downstream consumer.
 *
 * Raised by {@link TelemetrySink#connect()}. It is fatal to simulation start
 * and is never retried by the core.
 */
public final class ConnectionException extends TelemetrySimulatorException
{
    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
