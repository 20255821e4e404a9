package com.questrail.cncsim.transport;

import com.questrail.cncsim.format.WireMessage;

import java.util.List;

/**
 * TelemetrySink
 * -----------------------------------------------------------------------------
 * Delivery capability the simulation core depends on.
 *
 * <p>Implementations own exactly one transport concern (MQTT broker, HTTP
 * ingestion endpoint, log output). They perform a single delivery attempt per
 * call; retry and backoff belong to the publisher.</p>
 *
 * <p>{@link #publish} and {@link #publishBatch} may be called concurrently from
 * the publish executor once {@link #connect()} has returned.</p>
 */
public interface TelemetrySink
{
    /**
     * Establishes the connection.
     *
     * @throws ConnectionException if the downstream consumer is not reachable
     */
    void connect();

    /**
     * @throws DeliveryException if this attempt failed
     */
    void publish(WireMessage message);

    /**
     * @throws DeliveryException if this attempt failed
     */
    void publishBatch(List<WireMessage> messages);

    /**
     * Releases transport resources. Safe to call when not connected.
     */
    void disconnect();
}
