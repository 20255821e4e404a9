package com.questrail.cncsim.transport;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.questrail.cncsim.format.WireMessage;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of wire messages.
 *
 * <ul>
 *   <li>{@link #payloadJson} is the in-band body, as published to a broker</li>
 *   <li>{@link #envelopeJson} wraps one message for the HTTP ingestion API:
 *       {@code {topic, payload, metadata, timestamp}}</li>
 *   <li>{@link #batchJson} wraps several envelopes: {@code {messages:[...]}}</li>
 * </ul>
 *
 * Null attributes are omitted. Instances are immutable and thread-safe.
 */
public final class WirePayloadCodec
{
    private final Gson gson;

    public WirePayloadCodec() {
        this(new GsonBuilder().disableHtmlEscaping().create());
    }

    public WirePayloadCodec(Gson gson) {
        this.gson = gson;
    }

    public String payloadJson(WireMessage message) {
        return gson.toJson(message.payload());
    }

    public byte[] payloadBytes(WireMessage message) {
        return payloadJson(message).getBytes(StandardCharsets.UTF_8);
    }

    public String envelopeJson(WireMessage message, long sentAtMillis) {
        return gson.toJson(envelope(message, sentAtMillis));
    }

    public String batchJson(List<WireMessage> messages, long sentAtMillis) {
        List<Map<String, Object>> envelopes = new ArrayList<>(messages.size());
        for (WireMessage m : messages) {
            envelopes.add(envelope(m, sentAtMillis));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messages", envelopes);
        return gson.toJson(body);
    }

    private static Map<String, Object> envelope(WireMessage message, long sentAtMillis) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("topic", message.destination());
        envelope.put("payload", message.payload());
        envelope.put("metadata", message.metadata());
        envelope.put("timestamp", sentAtMillis);
        return envelope;
    }
}
