package com.questrail.cncsim.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SensorReading
 * -----------------------------------------------------------------------------
 * One synthesized value of one sensor of one machine, produced once per tick.
 *
 * <p>Readings are tick-scoped: they are formatted into wire messages and then
 * dropped. {@code value} and {@code timestamp} are deliberately nullable so
 * that a defective reading can still travel to the format layer, where the
 * validator rejects and counts it instead of the pipeline failing.</p>
 *
 * @param machineId  owning machine
 * @param sensorKey  hyphenated key, e.g. {@code spindle-speed}
 * @param category   data-contract category
 * @param value      {@link Number}, {@link String} or {@link Boolean}; may be {@code null}
 * @param quality    validity tag
 * @param unit       unit label, e.g. {@code rpm}
 * @param timestamp  generation instant; may be {@code null}
 * @param metadata   free-form diagnostics (phase, thresholds, ...), insertion ordered
 */
public record SensorReading(
        String machineId,
        String sensorKey,
        SensorCategory category,
        Object value,
        Quality quality,
        String unit,
        Instant timestamp,
        Map<String, Object> metadata
) {
    public SensorReading {
        Objects.requireNonNull(machineId, "machineId");
        Objects.requireNonNull(sensorKey, "sensorKey");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(quality, "quality");
        Objects.requireNonNull(unit, "unit");
        if (value != null && !(value instanceof Number || value instanceof String || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
        }
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Numeric view of the value.
     *
     * @throws IllegalStateException if the value is not numeric
     */
    public double numericValue() {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalStateException(sensorKey + " is not numeric: " + value);
    }
}
