package com.questrail.cncsim.runtime;

import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.config.FleetRoster;
import com.questrail.cncsim.config.SimulationConfig;
import com.questrail.cncsim.engine.MachineCycleEngine;
import com.questrail.cncsim.engine.RandomSource;
import com.questrail.cncsim.engine.SplittableRandomSource;
import com.questrail.cncsim.format.CompactSchemaAdapter;
import com.questrail.cncsim.format.HierarchicalSchemaAdapter;
import com.questrail.cncsim.format.ReadingFormatAdapter;
import com.questrail.cncsim.format.WireSchema;
import com.questrail.cncsim.observability.NullObservabilitySink;
import com.questrail.cncsim.observability.SimulationObservabilitySink;
import com.questrail.cncsim.publish.PublisherClient;
import com.questrail.cncsim.publish.RetryPolicy;
import com.questrail.cncsim.synthesis.SensorSynthesizer;
import com.questrail.cncsim.time.Cancellable;
import com.questrail.cncsim.time.MonotonicClock;
import com.questrail.cncsim.time.ScheduledExecutorScheduler;
import com.questrail.cncsim.time.Sleeper;
import com.questrail.cncsim.time.SystemMonotonicClock;
import com.questrail.cncsim.time.SystemWallClock;
import com.questrail.cncsim.time.WallClock;
import com.questrail.cncsim.transport.LoggingTelemetrySink;
import com.questrail.cncsim.transport.TelemetrySink;
import com.questrail.cncsim.transport.WirePayloadCodec;
import com.questrail.cncsim.transport.http.netty.NettyHttpIngestSink;
import com.questrail.cncsim.transport.mqtt.PahoMqttSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SimulationRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production simulation.
 *
 * <p>Wires clocks, the timer thread, the publish pool, one engine per roster
 * machine, the configured adapters, the publisher and the sink selected by
 * {@link SimulationConfig#sinkType()}. {@link #stop()} releases every thread
 * it created.</p>
 */
public final class SimulationRuntime {
    private static final Logger log = LoggerFactory.getLogger(SimulationRuntime.class);

    private final SimulationScheduler scheduler;
    private final ScheduledExecutorService timerExecutor;
    private final ExecutorService publishExecutor;
    private final MonotonicClock clock;
    private final SimulationConfig config;

    private Cancellable metricsLogger;

    private SimulationRuntime(
            SimulationScheduler scheduler,
            ScheduledExecutorService timerExecutor,
            ExecutorService publishExecutor,
            MonotonicClock clock,
            SimulationConfig config) {
        this.scheduler = scheduler;
        this.timerExecutor = timerExecutor;
        this.publishExecutor = publishExecutor;
        this.clock = clock;
        this.config = config;
    }

    public void start() {
        scheduler.start();
        if (!config.metricsLogInterval().isZero()) {
            scheduleMetricsLog();
        }
    }

    public void stop() {
        synchronized (this) {
            if (metricsLogger != null) {
                metricsLogger.cancel();
                metricsLogger = null;
            }
        }
        scheduler.stop();
        shutdown(timerExecutor);
        shutdown(publishExecutor);
    }

    public SimulationMetrics metrics() {
        return scheduler.metrics();
    }

    public SimulationScheduler scheduler() {
        return scheduler;
    }

    private synchronized void scheduleMetricsLog() {
        ScheduledExecutorScheduler timer = new ScheduledExecutorScheduler(timerExecutor, clock);
        metricsLogger = timer.scheduleAfter(config.metricsLogInterval(), clock, () -> {
            SimulationMetrics m = scheduler.metrics();
            log.info("Metrics: published={} rate={}/s active={} uptime={}s batches={} invalid={} failed={}",
                    m.totalMessagesPublished(), m.messagesPerSecond(), m.activeMachines(),
                    m.uptimeSeconds(), m.batchesSent(), m.validationFailures(), m.deliveryFailures());
            synchronized (this) {
                if (metricsLogger != null && scheduler.isRunning()) {
                    scheduleMetricsLog();
                }
            }
        });
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SimulationConfig config = SimulationConfig.defaults();
        private FleetRoster roster;
        private TelemetrySink sink;
        private SimulationObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(SimulationConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRoster(FleetRoster roster) {
            this.roster = roster;
            return this;
        }

        /**
         * Overrides the sink that {@link SimulationConfig#sinkType()} would select.
         */
        public Builder withSink(TelemetrySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withObservabilitySink(SimulationObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public SimulationRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Clocks and threads
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService timerExec = Executors.newSingleThreadScheduledExecutor(named("cncsim-timer"));
            ExecutorService publishExec = Executors.newFixedThreadPool(config.publishConcurrency(), named("cncsim-publish"));

            // 2. Fleet
            FleetRoster fleet = roster != null ? roster : FleetRoster.defaultRoster(config.enterprise(), config.site());
            SplittableRandom seeds = config.randomSeed() != null
                    ? new SplittableRandom(config.randomSeed())
                    : new SplittableRandom();
            SensorSynthesizer synthesizer = new SensorSynthesizer();
            Instant createdAt = wallClock.now();
            List<MachineCycleEngine> engines = new ArrayList<>();
            for (MachineProfile profile : fleet.machines()) {
                RandomSource random = new SplittableRandomSource(seeds.nextLong());
                engines.add(new MachineCycleEngine(profile, random, synthesizer, createdAt));
            }

            // 3. Formatting
            List<ReadingFormatAdapter> adapters = new ArrayList<>();
            if (config.schemaSelection().includes(WireSchema.HIERARCHICAL)) {
                adapters.add(new HierarchicalSchemaAdapter());
            }
            if (config.schemaSelection().includes(WireSchema.COMPACT)) {
                adapters.add(new CompactSchemaAdapter());
            }

            // 4. Delivery
            TelemetrySink effectiveSink = sink != null ? sink : createSink(config, wallClock);
            RetryPolicy retryPolicy = RetryPolicy.withMaxAttempts(config.maxAttempts());
            PublisherClient publisher = new PublisherClient(effectiveSink, retryPolicy, Sleeper.THREAD);

            // 5. Scheduler
            SimulationScheduler scheduler = SimulationScheduler.builder()
                    .withEngines(engines)
                    .withAdapters(adapters)
                    .withPublisher(publisher)
                    .withBatchSize(config.batchSize())
                    .withPeriod(config.publishInterval())
                    .withDrainTimeout(retryPolicy.worstCaseBackoff().plus(config.requestTimeout()))
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withScheduler(new ScheduledExecutorScheduler(timerExec, clock))
                    .withPublishExecutor(publishExec)
                    .withObservabilitySink(observabilitySink)
                    .build();

            return new SimulationRuntime(scheduler, timerExec, publishExec, clock, config);
        }

        private static TelemetrySink createSink(SimulationConfig config, WallClock wallClock) {
            WirePayloadCodec codec = new WirePayloadCodec();
            switch (config.sinkType()) {
                case HTTP:
                    return new NettyHttpIngestSink(config.ingestUrl(), config.requestTimeout(), codec, wallClock);
                case LOG:
                    return new LoggingTelemetrySink(codec);
                case MQTT:
                default:
                    String clientId = "cnc-simulator-" + Long.toHexString(new SplittableRandom().nextLong());
                    return new PahoMqttSink(config.mqttBrokerUrl(), clientId,
                            config.mqttUsername(), config.mqttPassword(), config.requestTimeout(), codec);
            }
        }

        private static ThreadFactory named(String prefix) {
            AtomicInteger n = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
