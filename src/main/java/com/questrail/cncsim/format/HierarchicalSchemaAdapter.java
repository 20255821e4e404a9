package com.questrail.cncsim.format;

import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.SensorReading;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hierarchical ("UNS") schema.
 *
 * <pre>
 *   address: {enterprise}/{site}/{area}/{cell}/{machine}/info/{category}/{sensor-key}
 *   payload: { timestamp, timestamp_ms, source, value, unit, quality, metadata }
 * </pre>
 *
 * Sensor keys keep their hyphenated form. All reading attributes travel
 * in-band, so the message carries no out-of-band metadata.
 */
public final class HierarchicalSchemaAdapter implements ReadingFormatAdapter
{
    public static final String SEPARATOR = "/";
    public static final String INFO_SEGMENT = "info";

    @Override
    public WireSchema schema() {
        return WireSchema.HIERARCHICAL;
    }

    @Override
    public WireMessage adapt(MachineProfile profile, SensorReading reading) {
        String destination = String.join(SEPARATOR,
                profile.location().join(SEPARATOR),
                profile.machineId(),
                INFO_SEGMENT,
                reading.category().segment(),
                reading.sensorKey());

        Long timestampMs = ReadingFormatAdapter.timestampMillis(reading);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", reading.timestamp() == null ? null : reading.timestamp().toString());
        payload.put("timestamp_ms", timestampMs);
        payload.put("source", reading.machineId());
        payload.put("value", reading.value());
        payload.put("unit", reading.unit());
        payload.put("quality", reading.quality().wireName());
        payload.put("metadata", reading.metadata());

        return new WireMessage(schema(), destination, reading.value(), timestampMs, payload, Map.of());
    }
}
