package com.questrail.cncsim.format;

import com.questrail.cncsim.api.Quality;
import com.questrail.cncsim.api.SensorCategory;
import com.questrail.cncsim.api.SensorReading;
import com.questrail.cncsim.api.TestProfiles;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompactSchemaAdapterTest {

    private static final Instant AT = Instant.parse("2024-05-01T08:00:03Z");

    private final CompactSchemaAdapter adapter = new CompactSchemaAdapter();

    private static SensorReading reading(String key, Object value) {
        return new SensorReading("cnc-001", key, SensorCategory.SENSORS, value, Quality.UNCERTAIN, "bar", AT,
                Map.of("nominal_pressure", 4.0));
    }

    @Test
    void buildsDottedAddressWithUnderscoredTag() {
        WireMessage m = adapter.adapt(TestProfiles.mill(), reading("coolant-pressure", 3.8));

        assertEquals("umh.v1.acme.plant1.machining.cell-01.cnc-001._raw.coolant_pressure", m.destination());
        assertEquals(WireSchema.COMPACT, m.schema());
    }

    @Test
    void payloadHoldsOnlyValueAndTimestamp() {
        WireMessage m = adapter.adapt(TestProfiles.mill(), reading("coolant-pressure", 3.8));

        assertEquals(List.of("value", "timestamp_ms"), List.copyOf(m.payload().keySet()));
        assertEquals(3.8, m.payload().get("value"));
        assertEquals(AT.toEpochMilli(), m.payload().get("timestamp_ms"));
    }

    @Test
    void metadataTravelsOutOfBand() {
        WireMessage m = adapter.adapt(TestProfiles.mill(), reading("coolant-pressure", 3.8));

        assertEquals("acme.plant1.machining.cell-01.cnc-001", m.metadataString("location_path"));
        assertEquals("_raw", m.metadataString("data_contract"));
        assertEquals("coolant_pressure", m.metadataString("tag_name"));
        assertEquals("bar", m.metadataString("unit"));
        assertEquals("uncertain", m.metadataString("quality"));
        assertEquals("cnc-001", m.metadataString("source"));
        assertEquals(Map.of("nominal_pressure", 4.0), m.metadata().get("original_metadata"));
    }

    @Test
    void tagNameReplacesEveryHyphen() {
        assertEquals("position_x", CompactSchemaAdapter.tagName("position-x"));
        assertEquals("efficiency", CompactSchemaAdapter.tagName("efficiency"));
    }
}
