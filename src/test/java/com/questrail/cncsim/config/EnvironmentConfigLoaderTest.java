package com.questrail.cncsim.config;

import com.questrail.cncsim.format.SchemaSelection;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentConfigLoaderTest {

    @Test
    void emptyEnvironmentYieldsDefaults() {
        SimulationConfig c = EnvironmentConfigLoader.load(Map.of());

        assertEquals(SimulationConfig.defaults(), c);
        assertEquals(SinkType.MQTT, c.sinkType());
        assertEquals("tcp://localhost:1883", c.mqttBrokerUrl());
        assertEquals(Duration.ofMillis(3000), c.publishInterval());
        assertEquals(SchemaSelection.HIERARCHICAL, c.schemaSelection());
        assertEquals(1, c.batchSize());
        assertFalse(c.batching());
        assertEquals(3, c.maxAttempts());
        assertEquals("demo-factory", c.enterprise());
        assertEquals("plant1", c.site());
        assertNull(c.randomSeed());
        assertNull(c.mqttUsername());
    }

    @Test
    void readsEveryVariable() {
        Map<String, String> env = new HashMap<>();
        env.put("SINK", "http");
        env.put("MQTT_BROKER_URL", "tcp://broker:1883");
        env.put("MQTT_USERNAME", "sim");
        env.put("MQTT_PASSWORD", "secret");
        env.put("UMH_CORE_URL", "http://umh:8040");
        env.put("REQUEST_TIMEOUT", "2500");
        env.put("PUBLISH_INTERVAL", "1000");
        env.put("OUTPUT_FORMAT", "both");
        env.put("BATCH_SIZE", "25");
        env.put("MAX_RETRIES", "5");
        env.put("PUBLISH_CONCURRENCY", "4");
        env.put("FACTORY_NAME", "acme");
        env.put("SITE_NAME", "north");
        env.put("METRICS_LOG_INTERVAL", "0");
        env.put("RANDOM_SEED", "99");

        SimulationConfig c = EnvironmentConfigLoader.load(env);

        assertEquals(SinkType.HTTP, c.sinkType());
        assertEquals("tcp://broker:1883", c.mqttBrokerUrl());
        assertEquals("sim", c.mqttUsername());
        assertEquals("secret", c.mqttPassword());
        assertEquals(URI.create("http://umh:8040"), c.ingestUrl());
        assertEquals(Duration.ofMillis(2500), c.requestTimeout());
        assertEquals(Duration.ofSeconds(1), c.publishInterval());
        assertEquals(SchemaSelection.BOTH, c.schemaSelection());
        assertEquals(25, c.batchSize());
        assertTrue(c.batching());
        assertEquals(5, c.maxAttempts());
        assertEquals(4, c.publishConcurrency());
        assertEquals("acme", c.enterprise());
        assertEquals("north", c.site());
        assertEquals(Duration.ZERO, c.metricsLogInterval());
        assertEquals(99L, c.randomSeed());
    }

    @Test
    void legacyLocationNamesAreFallbacks() {
        SimulationConfig c = EnvironmentConfigLoader.load(Map.of(
                "ENTERPRISE_NAME", "legacy-co",
                "PLANT_NAME", "legacy-plant"));

        assertEquals("legacy-co", c.enterprise());
        assertEquals("legacy-plant", c.site());

        SimulationConfig preferred = EnvironmentConfigLoader.load(Map.of(
                "FACTORY_NAME", "new-co",
                "ENTERPRISE_NAME", "legacy-co"));
        assertEquals("new-co", preferred.enterprise());
    }

    @Test
    void outputFormatAcceptsSchemaAliases() {
        assertEquals(SchemaSelection.COMPACT,
                EnvironmentConfigLoader.load(Map.of("OUTPUT_FORMAT", "umh-core")).schemaSelection());
        assertEquals(SchemaSelection.HIERARCHICAL,
                EnvironmentConfigLoader.load(Map.of("OUTPUT_FORMAT", "UNS")).schemaSelection());
    }

    @Test
    void blankValuesAreIgnored() {
        SimulationConfig c = EnvironmentConfigLoader.load(Map.of("BATCH_SIZE", "  ", "SINK", ""));

        assertEquals(1, c.batchSize());
        assertEquals(SinkType.MQTT, c.sinkType());
    }

    @Test
    void malformedNumberNamesTheVariable() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfigLoader.load(Map.of("PUBLISH_INTERVAL", "fast")));

        assertTrue(e.getMessage().contains("PUBLISH_INTERVAL"));
        assertTrue(e.getMessage().contains("fast"));
    }

    @Test
    void unknownWordsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfigLoader.load(Map.of("OUTPUT_FORMAT", "xml")));
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfigLoader.load(Map.of("SINK", "kafka")));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfigLoader.load(Map.of("BATCH_SIZE", "0")));
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfigLoader.load(Map.of("PUBLISH_INTERVAL", "0")));
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentConfigLoader.load(Map.of("MAX_RETRIES", "0")));
    }
}
