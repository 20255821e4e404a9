package com.questrail.cncsim.transport.mqtt;

import com.questrail.cncsim.format.WireMessage;
import com.questrail.cncsim.transport.ConnectionException;
import com.questrail.cncsim.transport.DeliveryException;
import com.questrail.cncsim.transport.TelemetrySink;
import com.questrail.cncsim.transport.WirePayloadCodec;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * PahoMqttSink
 * =============================================================================
 * Eclipse Paho implementation of {@link TelemetrySink}.
 *
 * <h2>Architectural Role</h2>
 * Pure transport adapter: publishes the JSON payload of each message to the
 * message's destination topic. It performs exactly one attempt per call and
 * never retries on its own.
 *
 * <h2>Paho containment rule</h2>
 * Paho types and {@link MqttException} do not escape this package; failures
 * surface as {@link ConnectionException} or {@link DeliveryException}.
 *
 * <h2>Delivery</h2>
 * QoS 1 (at least once), not retained, clean session. Batches are published
 * message by message; the first failing message fails the batch.
 */
public final class PahoMqttSink implements TelemetrySink
{
    private static final Logger log = LoggerFactory.getLogger(PahoMqttSink.class);

    public static final int QOS = 1;

    private final String brokerUrl;
    private final String clientId;
    private final String username;
    private final char[] password;
    private final Duration connectTimeout;
    private final WirePayloadCodec codec;

    private volatile MqttClient client;

    public PahoMqttSink(String brokerUrl,
                        String clientId,
                        String username,
                        String password,
                        Duration connectTimeout,
                        WirePayloadCodec codec)
    {
        this.brokerUrl = Objects.requireNonNull(brokerUrl, "brokerUrl");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.username = username;
        this.password = password == null ? null : password.toCharArray();
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public synchronized void connect()
    {
        if (client != null && client.isConnected()) {
            return;
        }

        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(true);
        options.setConnectionTimeout((int) Math.max(1, connectTimeout.toSeconds()));
        if (username != null && !username.isBlank()) {
            options.setUserName(username);
            if (password != null) {
                options.setPassword(password);
            }
        }

        MqttClient c = null;
        try {
            c = new MqttClient(brokerUrl, clientId, new MemoryPersistence());
            c.connect(options);
            client = c;
            log.info("Connected to MQTT broker {} as {}", brokerUrl, clientId);
        }
        catch (MqttException e) {
            closeQuietly(c);
            throw new ConnectionException("MQTT connection to " + brokerUrl + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void publish(WireMessage message)
    {
        MqttClient c = requireClient(message.destination());
        MqttMessage mqttMessage = new MqttMessage(codec.payloadBytes(message));
        mqttMessage.setQos(QOS);
        mqttMessage.setRetained(false);
        try {
            c.publish(message.destination(), mqttMessage);
        }
        catch (MqttException e) {
            throw new DeliveryException(message.destination(),
                    "MQTT publish to " + message.destination() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void publishBatch(List<WireMessage> messages)
    {
        for (WireMessage m : messages) {
            publish(m);
        }
    }

    @Override
    public synchronized void disconnect()
    {
        MqttClient c = client;
        client = null;
        if (c == null) {
            return;
        }
        try {
            if (c.isConnected()) {
                c.disconnect();
            }
            log.info("Disconnected from MQTT broker {}", brokerUrl);
        }
        catch (MqttException e) {
            log.warn("MQTT disconnect from {} failed: {}", brokerUrl, e.getMessage());
        }
        finally {
            closeQuietly(c);
        }
    }

    private MqttClient requireClient(String destination)
    {
        MqttClient c = client;
        if (c == null || !c.isConnected()) {
            throw new DeliveryException(destination, "MQTT client not connected to " + brokerUrl);
        }
        return c;
    }

    private static void closeQuietly(MqttClient c)
    {
        if (c == null) {
            return;
        }
        try {
            c.close();
        }
        catch (MqttException e) {
            log.debug("Closing MQTT client failed: {}", e.getMessage());
        }
    }
}
