package com.questrail.cncsim.transport;

import com.questrail.cncsim.api.TelemetrySimulatorException;

/**
 * Indicates that a message or batch could not be delivered.
 *
 * <p>Sinks throw it for a single failed attempt; the publisher throws it again
 * once every attempt has failed, naming the destination and carrying the last
 * underlying cause.</p>
 */
public final class DeliveryException extends TelemetrySimulatorException
{
    private final String destination;

    public DeliveryException(String destination, String message) {
        super(message);
        this.destination = destination;
    }

    public DeliveryException(String destination, String message, Throwable cause) {
        super(message, cause);
        this.destination = destination;
    }

    /**
     * Destination address of the failed message, or a batch description such
     * as {@code "batch[25]"}.
     */
    public String destination() {
        return destination;
    }
}
