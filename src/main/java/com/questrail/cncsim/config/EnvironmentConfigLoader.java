package com.questrail.cncsim.config;

import com.questrail.cncsim.format.SchemaSelection;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Builds a {@link SimulationConfig} from environment variables.
 *
 * <p>Unset or blank variables keep the builder default. Malformed values fail
 * with an {@link IllegalArgumentException} naming the variable.</p>
 */
public final class EnvironmentConfigLoader
{
    public static final String SINK = "SINK";
    public static final String MQTT_BROKER_URL = "MQTT_BROKER_URL";
    public static final String MQTT_USERNAME = "MQTT_USERNAME";
    public static final String MQTT_PASSWORD = "MQTT_PASSWORD";
    public static final String UMH_CORE_URL = "UMH_CORE_URL";
    public static final String REQUEST_TIMEOUT = "REQUEST_TIMEOUT";
    public static final String PUBLISH_INTERVAL = "PUBLISH_INTERVAL";
    public static final String OUTPUT_FORMAT = "OUTPUT_FORMAT";
    public static final String BATCH_SIZE = "BATCH_SIZE";
    public static final String MAX_RETRIES = "MAX_RETRIES";
    public static final String PUBLISH_CONCURRENCY = "PUBLISH_CONCURRENCY";
    public static final String FACTORY_NAME = "FACTORY_NAME";
    public static final String ENTERPRISE_NAME = "ENTERPRISE_NAME";
    public static final String SITE_NAME = "SITE_NAME";
    public static final String PLANT_NAME = "PLANT_NAME";
    public static final String METRICS_LOG_INTERVAL = "METRICS_LOG_INTERVAL";
    public static final String RANDOM_SEED = "RANDOM_SEED";

    private EnvironmentConfigLoader() {
    }

    public static SimulationConfig fromSystemEnvironment() {
        return load(System.getenv());
    }

    public static SimulationConfig load(Map<String, String> env) {
        SimulationConfig.Builder b = SimulationConfig.builder();

        String sink = value(env, SINK);
        if (sink != null) {
            b.withSinkType(parse(SINK, sink, SinkType::parse));
        }
        String broker = value(env, MQTT_BROKER_URL);
        if (broker != null) {
            b.withMqttBrokerUrl(broker);
        }
        b.withMqttCredentials(value(env, MQTT_USERNAME), value(env, MQTT_PASSWORD));

        String ingest = value(env, UMH_CORE_URL);
        if (ingest != null) {
            b.withIngestUrl(parse(UMH_CORE_URL, ingest, URI::create));
        }
        String timeout = value(env, REQUEST_TIMEOUT);
        if (timeout != null) {
            b.withRequestTimeout(millis(REQUEST_TIMEOUT, timeout));
        }
        String interval = value(env, PUBLISH_INTERVAL);
        if (interval != null) {
            b.withPublishInterval(millis(PUBLISH_INTERVAL, interval));
        }
        String format = value(env, OUTPUT_FORMAT);
        if (format != null) {
            b.withSchemaSelection(parse(OUTPUT_FORMAT, format, SchemaSelection::parse));
        }
        String batch = value(env, BATCH_SIZE);
        if (batch != null) {
            b.withBatchSize(parse(BATCH_SIZE, batch, Integer::parseInt));
        }
        String retries = value(env, MAX_RETRIES);
        if (retries != null) {
            b.withMaxAttempts(parse(MAX_RETRIES, retries, Integer::parseInt));
        }
        String concurrency = value(env, PUBLISH_CONCURRENCY);
        if (concurrency != null) {
            b.withPublishConcurrency(parse(PUBLISH_CONCURRENCY, concurrency, Integer::parseInt));
        }

        String enterprise = firstOf(env, FACTORY_NAME, ENTERPRISE_NAME);
        if (enterprise != null) {
            b.withEnterprise(enterprise);
        }
        String site = firstOf(env, SITE_NAME, PLANT_NAME);
        if (site != null) {
            b.withSite(site);
        }

        String metrics = value(env, METRICS_LOG_INTERVAL);
        if (metrics != null) {
            b.withMetricsLogInterval(millis(METRICS_LOG_INTERVAL, metrics));
        }
        String seed = value(env, RANDOM_SEED);
        if (seed != null) {
            b.withRandomSeed(parse(RANDOM_SEED, seed, Long::parseLong));
        }

        try {
            return b.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static String value(Map<String, String> env, String name) {
        String v = env.get(name);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static String firstOf(Map<String, String> env, String primary, String fallback) {
        String v = value(env, primary);
        return v != null ? v : value(env, fallback);
    }

    private static Duration millis(String name, String text) {
        return Duration.ofMillis(parse(name, text, Long::parseLong));
    }

    private static <T> T parse(String name, String text, Function<String, T> parser) {
        try {
            return parser.apply(text);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(name + " has an invalid value: '" + text + "'", e);
        }
    }
}
