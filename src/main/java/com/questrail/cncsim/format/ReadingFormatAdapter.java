package com.questrail.cncsim.format;

import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.SensorReading;

import java.time.Instant;

/**
 * Converts one sensor reading into a message of a single wire schema.
 *
 * <p>Adapters never validate; the scheduler passes every message through
 * {@link WireMessageValidator} before handing it to the publisher.</p>
 */
public interface ReadingFormatAdapter
{
    WireSchema schema();

    WireMessage adapt(MachineProfile profile, SensorReading reading);

    /**
     * Millisecond timestamp of {@code reading}, or {@code null} when it has none.
     */
    static Long timestampMillis(SensorReading reading) {
        Instant ts = reading.timestamp();
        return ts == null ? null : ts.toEpochMilli();
    }
}
