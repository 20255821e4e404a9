package com.questrail.cncsim.config;

import com.questrail.cncsim.format.SchemaSelection;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for one simulation run.
 *
 * <p>{@code mqttUsername}, {@code mqttPassword} and {@code randomSeed} are
 * optional and may be {@code null}. A {@code batchSize} of 1 disables
 * batching.</p>
 */
public record SimulationConfig(
    SinkType sinkType,
    String mqttBrokerUrl,
    String mqttUsername,
    String mqttPassword,
    URI ingestUrl,
    Duration requestTimeout,
    Duration publishInterval,
    SchemaSelection schemaSelection,
    int batchSize,
    int maxAttempts,
    int publishConcurrency,
    String enterprise,
    String site,
    Duration metricsLogInterval,
    Long randomSeed
) {
    public static final String DEFAULT_BROKER_URL = "tcp://localhost:1883";
    public static final URI DEFAULT_INGEST_URL = URI.create("http://localhost:8080");
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_PUBLISH_INTERVAL = Duration.ofMillis(3000);
    public static final int DEFAULT_PUBLISH_CONCURRENCY = 8;
    public static final String DEFAULT_ENTERPRISE = "demo-factory";
    public static final String DEFAULT_SITE = "plant1";
    public static final Duration DEFAULT_METRICS_LOG_INTERVAL = Duration.ofMillis(30000);

    public SimulationConfig {
        Objects.requireNonNull(sinkType, "sinkType");
        Objects.requireNonNull(mqttBrokerUrl, "mqttBrokerUrl");
        Objects.requireNonNull(ingestUrl, "ingestUrl");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(publishInterval, "publishInterval");
        Objects.requireNonNull(schemaSelection, "schemaSelection");
        Objects.requireNonNull(enterprise, "enterprise");
        Objects.requireNonNull(site, "site");
        Objects.requireNonNull(metricsLogInterval, "metricsLogInterval");

        if (publishInterval.isNegative() || publishInterval.isZero()) {
            throw new IllegalArgumentException("publishInterval must be positive");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (metricsLogInterval.isNegative()) {
            throw new IllegalArgumentException("metricsLogInterval must be non-negative");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (publishConcurrency < 1) {
            throw new IllegalArgumentException("publishConcurrency must be >= 1");
        }
        if (enterprise.isBlank() || site.isBlank()) {
            throw new IllegalArgumentException("enterprise and site must not be blank");
        }
    }

    public boolean batching() {
        return batchSize > 1;
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SinkType sinkType = SinkType.MQTT;
        private String mqttBrokerUrl = DEFAULT_BROKER_URL;
        private String mqttUsername;
        private String mqttPassword;
        private URI ingestUrl = DEFAULT_INGEST_URL;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration publishInterval = DEFAULT_PUBLISH_INTERVAL;
        private SchemaSelection schemaSelection = SchemaSelection.HIERARCHICAL;
        private int batchSize = 1;
        private int maxAttempts = 3;
        private int publishConcurrency = DEFAULT_PUBLISH_CONCURRENCY;
        private String enterprise = DEFAULT_ENTERPRISE;
        private String site = DEFAULT_SITE;
        private Duration metricsLogInterval = DEFAULT_METRICS_LOG_INTERVAL;
        private Long randomSeed;

        public Builder withSinkType(SinkType sinkType) {
            this.sinkType = sinkType;
            return this;
        }

        public Builder withMqttBrokerUrl(String url) {
            this.mqttBrokerUrl = url;
            return this;
        }

        public Builder withMqttCredentials(String username, String password) {
            this.mqttUsername = username;
            this.mqttPassword = password;
            return this;
        }

        public Builder withIngestUrl(URI url) {
            this.ingestUrl = url;
            return this;
        }

        public Builder withRequestTimeout(Duration timeout) {
            this.requestTimeout = timeout;
            return this;
        }

        public Builder withPublishInterval(Duration interval) {
            this.publishInterval = interval;
            return this;
        }

        public Builder withSchemaSelection(SchemaSelection selection) {
            this.schemaSelection = selection;
            return this;
        }

        public Builder withBatchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder withMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder withPublishConcurrency(int threads) {
            this.publishConcurrency = threads;
            return this;
        }

        public Builder withEnterprise(String enterprise) {
            this.enterprise = enterprise;
            return this;
        }

        public Builder withSite(String site) {
            this.site = site;
            return this;
        }

        public Builder withMetricsLogInterval(Duration interval) {
            this.metricsLogInterval = interval;
            return this;
        }

        public Builder withRandomSeed(Long seed) {
            this.randomSeed = seed;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(sinkType, mqttBrokerUrl, mqttUsername, mqttPassword,
                    ingestUrl, requestTimeout, publishInterval, schemaSelection, batchSize,
                    maxAttempts, publishConcurrency, enterprise, site, metricsLogInterval, randomSeed);
        }
    }
}
