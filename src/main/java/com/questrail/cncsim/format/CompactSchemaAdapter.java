package com.questrail.cncsim.format;

import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.SensorReading;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compact ("UMH") schema.
 *
 * <pre>
 *   address:  umh.v1.{enterprise}.{site}.{area}.{cell}.{machine}._raw.{sensor_key}
 *   payload:  { value, timestamp_ms }
 *   metadata: location_path, data_contract, tag_name, unit, quality, source,
 *             original_metadata
 * </pre>
 *
 * Sensor keys are converted to underscores.
 */
public final class CompactSchemaAdapter implements ReadingFormatAdapter
{
    public static final String PREFIX = "umh.v1.";
    public static final String RAW_CONTRACT = "_raw";

    @Override
    public WireSchema schema() {
        return WireSchema.COMPACT;
    }

    @Override
    public WireMessage adapt(MachineProfile profile, SensorReading reading) {
        String locationPath = profile.location().join(".") + "." + profile.machineId();
        String tagName = tagName(reading.sensorKey());
        String destination = PREFIX + locationPath + "." + RAW_CONTRACT + "." + tagName;

        Long timestampMs = ReadingFormatAdapter.timestampMillis(reading);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("value", reading.value());
        payload.put("timestamp_ms", timestampMs);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("location_path", locationPath);
        metadata.put("data_contract", RAW_CONTRACT);
        metadata.put("tag_name", tagName);
        metadata.put("unit", reading.unit());
        metadata.put("quality", reading.quality().wireName());
        metadata.put("source", reading.machineId());
        metadata.put("original_metadata", reading.metadata());

        return new WireMessage(schema(), destination, reading.value(), timestampMs, payload, metadata);
    }

    /**
     * {@code spindle-speed} becomes {@code spindle_speed}.
     */
    public static String tagName(String sensorKey) {
        return sensorKey.replace('-', '_');
    }
}
