package com.questrail.cncsim.transport;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.questrail.cncsim.format.WireMessage;
import com.questrail.cncsim.format.WireSchema;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WirePayloadCodecTest {

    private final WirePayloadCodec codec = new WirePayloadCodec();

    private static WireMessage compact(String tag, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("value", value);
        payload.put("timestamp_ms", 1714550400000L);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tag_name", tag);
        metadata.put("unit", "°C");
        return new WireMessage(WireSchema.COMPACT, "umh.v1.acme._raw." + tag, value, 1714550400000L, payload, metadata);
    }

    @Test
    void payloadIsTheInBandBodyOnly() {
        JsonObject json = JsonParser.parseString(codec.payloadJson(compact("temperature", 61.5))).getAsJsonObject();

        assertEquals(2, json.size());
        assertEquals(61.5, json.get("value").getAsDouble());
        assertEquals(1714550400000L, json.get("timestamp_ms").getAsLong());
    }

    @Test
    void integralValuesStayIntegral() {
        assertEquals("{\"value\":4200,\"timestamp_ms\":1714550400000}", codec.payloadJson(compact("spindle_speed", 4200L)));
    }

    @Test
    void payloadBytesAreUtf8() {
        WireMessage m = new WireMessage(WireSchema.HIERARCHICAL, "a/b", "idle", 1L, Map.of("unit", "°C"), Map.of());

        assertEquals("{\"unit\":\"°C\"}", new String(codec.payloadBytes(m), StandardCharsets.UTF_8));
    }

    @Test
    void envelopeWrapsTopicPayloadMetadataAndSendTime() {
        JsonObject json = JsonParser.parseString(codec.envelopeJson(compact("temperature", 61.5), 99L)).getAsJsonObject();

        assertEquals("umh.v1.acme._raw.temperature", json.get("topic").getAsString());
        assertEquals(61.5, json.getAsJsonObject("payload").get("value").getAsDouble());
        assertEquals("temperature", json.getAsJsonObject("metadata").get("tag_name").getAsString());
        assertEquals(99L, json.get("timestamp").getAsLong());
    }

    @Test
    void batchListsEnvelopesInOrder() {
        String body = codec.batchJson(List.of(compact("a", 1L), compact("b", 2L)), 5L);
        JsonArray messages = JsonParser.parseString(body).getAsJsonObject().getAsJsonArray("messages");

        assertEquals(2, messages.size());
        assertEquals("umh.v1.acme._raw.a", messages.get(0).getAsJsonObject().get("topic").getAsString());
        assertEquals("umh.v1.acme._raw.b", messages.get(1).getAsJsonObject().get("topic").getAsString());
    }

    @Test
    void nullAttributesAreOmitted() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("value", 1L);
        payload.put("timestamp", null);
        WireMessage m = new WireMessage(WireSchema.HIERARCHICAL, "a/b", 1L, 1L, payload, Map.of());

        assertEquals("{\"value\":1}", codec.payloadJson(m));
    }

    @Test
    void markupIsNotEscaped() {
        WireMessage m = new WireMessage(WireSchema.HIERARCHICAL, "a/b", "x", 1L, Map.of("note", "<a&b>"), Map.of());

        assertEquals("{\"note\":\"<a&b>\"}", codec.payloadJson(m));
    }
}
