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

class HierarchicalSchemaAdapterTest {

    private static final Instant AT = Instant.parse("2024-05-01T08:00:03.250Z");

    private final HierarchicalSchemaAdapter adapter = new HierarchicalSchemaAdapter();

    private static SensorReading reading(String key, SensorCategory category, Object value, Instant at) {
        return new SensorReading("cnc-001", key, category, value, Quality.GOOD, "rpm", at, Map.of("phase", "machining"));
    }

    @Test
    void buildsSlashSeparatedAddress() {
        WireMessage m = adapter.adapt(TestProfiles.mill(), reading("spindle-speed", SensorCategory.SENSORS, 4200L, AT));

        assertEquals("acme/plant1/machining/cell-01/cnc-001/info/sensors/spindle-speed", m.destination());
        assertEquals(WireSchema.HIERARCHICAL, m.schema());
    }

    @Test
    void categorySelectsAddressSegment() {
        WireMessage m = adapter.adapt(TestProfiles.mill(), reading("parts-count", SensorCategory.PRODUCTION, 3L, AT));

        assertTrue(m.destination().endsWith("/info/production/parts-count"));
    }

    @Test
    void payloadCarriesTheWholeReadingInOrder() {
        WireMessage m = adapter.adapt(TestProfiles.mill(), reading("spindle-speed", SensorCategory.SENSORS, 4200L, AT));

        assertEquals(List.of("timestamp", "timestamp_ms", "source", "value", "unit", "quality", "metadata"),
                List.copyOf(m.payload().keySet()));
        assertEquals("2024-05-01T08:00:03.250Z", m.payload().get("timestamp"));
        assertEquals(AT.toEpochMilli(), m.payload().get("timestamp_ms"));
        assertEquals("cnc-001", m.payload().get("source"));
        assertEquals(4200L, m.payload().get("value"));
        assertEquals("good", m.payload().get("quality"));
        assertEquals(Map.of("phase", "machining"), m.payload().get("metadata"));
        assertTrue(m.metadata().isEmpty());
    }

    @Test
    void missingTimestampIsCarriedAsNull() {
        WireMessage m = adapter.adapt(TestProfiles.mill(), reading("spindle-speed", SensorCategory.SENSORS, 1L, null));

        assertNull(m.timestampMs());
        assertNull(m.payload().get("timestamp"));
    }
}
