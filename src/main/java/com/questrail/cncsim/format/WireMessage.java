package com.questrail.cncsim.format;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One formatted message ready for delivery.
 *
 * @param schema      schema that produced the message
 * @param destination topic or address the sink publishes to
 * @param value       reading value; {@code null} for a defective reading
 * @param timestampMs epoch milliseconds; {@code null} when the reading had none
 * @param payload     in-band body exactly as it goes on the wire
 * @param metadata    out-of-band attributes; empty for schemas that carry
 *                    everything in-band
 */
public record WireMessage(
        WireSchema schema,
        String destination,
        Object value,
        Long timestampMs,
        Map<String, Object> payload,
        Map<String, Object> metadata
) {
    public WireMessage {
        Objects.requireNonNull(schema, "schema");
        payload = freeze(payload);
        metadata = freeze(metadata);
    }

    private static Map<String, Object> freeze(Map<String, Object> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /**
     * String attribute from the out-of-band metadata, or {@code null}.
     */
    public String metadataString(String key) {
        Object v = metadata.get(key);
        return v == null ? null : v.toString();
    }
}
