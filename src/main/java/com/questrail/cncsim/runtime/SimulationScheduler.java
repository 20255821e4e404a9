package com.questrail.cncsim.runtime;

import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.SensorReading;
import com.questrail.cncsim.engine.MachineCycleEngine;
import com.questrail.cncsim.engine.TickResult;
import com.questrail.cncsim.format.ReadingFormatAdapter;
import com.questrail.cncsim.format.ValidationException;
import com.questrail.cncsim.format.WireMessage;
import com.questrail.cncsim.format.WireMessageValidator;
import com.questrail.cncsim.format.WireSchema;
import com.questrail.cncsim.observability.DeliveryFailureEvent;
import com.questrail.cncsim.observability.NullObservabilitySink;
import com.questrail.cncsim.observability.SimulationErrorEvent;
import com.questrail.cncsim.observability.SimulationObservabilitySink;
import com.questrail.cncsim.observability.TickCompletedEvent;
import com.questrail.cncsim.observability.ValidationFailureEvent;
import com.questrail.cncsim.publish.PublisherClient;
import com.questrail.cncsim.time.Cancellable;
import com.questrail.cncsim.time.MonotonicClock;
import com.questrail.cncsim.time.MonotonicScheduler;
import com.questrail.cncsim.time.WallClock;
import com.questrail.cncsim.transport.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * SimulationScheduler
 * =============================================================================
 * Drives the fleet: one timer, one tick per period, concurrent delivery.
 *
 * <h2>Tick</h2>
 * <ol>
 *   <li>Skip engines whose machine is unreachable.</li>
 *   <li>Tick every remaining engine at the same wall-clock instant.</li>
 *   <li>Format each reading with every configured adapter and validate the
 *       result; invalid messages are reported, counted and dropped.</li>
 *   <li>Publish individually, or in batches of at most {@code batchSize}
 *       messages per schema, on the publish executor.</li>
 *   <li>Once every publish of the tick has completed or failed, update the
 *       metrics.</li>
 * </ol>
 *
 * <h2>Cadence</h2>
 * The timer re-arms itself from the previous deadline before the tick runs,
 * so a slow delivery never delays the next tick. Ticks may therefore overlap
 * in their delivery phase. Generation is serialized: engines are only ever
 * advanced by one thread at a time.
 *
 * <h2>Failures</h2>
 * Nothing that happens to a single message, batch or machine aborts a tick or
 * stops the timer. Only a connection failure in {@link #start()} propagates.
 */
public final class SimulationScheduler
{
    private static final Logger log = LoggerFactory.getLogger(SimulationScheduler.class);

    private final Map<String, MachineCycleEngine> engines;
    private final List<ReadingFormatAdapter> adapters;
    private final WireMessageValidator validator;
    private final PublisherClient publisher;
    private final int batchSize;
    private final long periodNanos;
    private final Duration drainTimeout;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler timer;
    private final Executor publishExecutor;
    private final SimulationObservabilitySink observability;
    private final MetricsAccumulator metrics;

    private final Object lifecycleLock = new Object();
    private final Object generationLock = new Object();
    private final Set<CompletableFuture<TickCompletedEvent>> inFlight = ConcurrentHashMap.newKeySet();

    private boolean running;
    private long nextDeadlineNanos;
    private Cancellable armed;

    private SimulationScheduler(Builder b) {
        Map<String, MachineCycleEngine> byId = new LinkedHashMap<>();
        for (MachineCycleEngine e : b.engines) {
            if (byId.put(e.machineId(), e) != null) {
                throw new IllegalArgumentException("Duplicate machine id: " + e.machineId());
            }
        }
        this.engines = Collections.unmodifiableMap(byId);
        this.adapters = List.copyOf(b.adapters);
        this.validator = new WireMessageValidator();
        this.publisher = b.publisher;
        this.batchSize = b.batchSize;
        this.periodNanos = b.period.toNanos();
        this.drainTimeout = b.drainTimeout != null
                ? b.drainTimeout
                : b.publisher.retryPolicy().worstCaseBackoff().plus(Duration.ofSeconds(5));
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.timer = b.scheduler;
        this.publishExecutor = b.publishExecutor;
        this.observability = b.observability;
        this.metrics = new MetricsAccumulator(b.clock, b.wallClock);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Connects the publisher and arms the periodic timer. The first tick
     * fires one period after this call.
     *
     * @throws SimulationAlreadyRunningException if already running
     * @throws ConnectionException if the sink cannot connect; the sink is
     *         disconnected again and the scheduler stays stopped
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                throw new SimulationAlreadyRunningException("Simulation is already running");
            }
            try {
                publisher.connect();
            }
            catch (RuntimeException e) {
                publisher.disconnect();
                throw e;
            }

            running = true;
            metrics.markStarted();
            nextDeadlineNanos = clock.nowNanos() + periodNanos;
            armed = timer.scheduleAtNanos(nextDeadlineNanos, this::onTimer);
        }
        log.info("Simulation started: {} machines ({} active), period {} ms, batch size {}",
                engines.size(), activeEngineCount(), TimeUnit.NANOSECONDS.toMillis(periodNanos), batchSize);
    }

    /**
     * Cancels the timer, waits for in-flight publishes to drain and then
     * disconnects the publisher. A no-op when not running.
     */
    public void stop() {
        List<CompletableFuture<TickCompletedEvent>> pending;
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            if (armed != null) {
                armed.cancel();
                armed = null;
            }
            pending = new ArrayList<>(inFlight);
        }

        drain(pending);
        metrics.markStopped();
        publisher.disconnect();
        log.info("Simulation stopped: {}", metrics.snapshot());
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return running;
        }
    }

    /**
     * Runs one tick immediately, outside the timer cadence.
     *
     * @return completes when every publish of the tick has completed
     * @throws SimulationNotRunningException if the simulation is not running
     */
    public CompletableFuture<TickCompletedEvent> runTick() {
        CompletableFuture<TickCompletedEvent> done = beginTick();
        if (done == null) {
            throw new SimulationNotRunningException("Simulation is not running");
        }
        tick(done);
        return done;
    }

    public SimulationMetrics metrics() {
        return metrics.snapshot();
    }

    public Collection<MachineCycleEngine> engines() {
        return engines.values();
    }

    public MachineCycleEngine engine(String machineId) {
        return engines.get(machineId);
    }

    // ---------------------------------------------------------------------
    // Timer
    // ---------------------------------------------------------------------

    private void onTimer() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            nextDeadlineNanos += periodNanos;
            armed = timer.scheduleAtNanos(nextDeadlineNanos, this::onTimer);
        }

        CompletableFuture<TickCompletedEvent> done = beginTick();
        if (done != null) {
            tick(done);
        }
    }

    /**
     * Registers a tick as in flight, or returns {@code null} when stopped.
     */
    private CompletableFuture<TickCompletedEvent> beginTick() {
        synchronized (lifecycleLock) {
            if (!running) {
                return null;
            }
            CompletableFuture<TickCompletedEvent> done = new CompletableFuture<>();
            inFlight.add(done);
            done.whenComplete((event, failure) -> inFlight.remove(done));
            return done;
        }
    }

    // ---------------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------------

    private void tick(CompletableFuture<TickCompletedEvent> done) {
        long tickNumber = metrics.nextTickNumber();
        long startedNanos = clock.nowNanos();
        try {
            Generated generated = generate();
            List<CompletableFuture<Delivery>> deliveries = dispatch(generated.bySchema);

            CompletableFuture.allOf(deliveries.toArray(new CompletableFuture<?>[0]))
                    .whenComplete((ignored, failure) -> {
                        try {
                            done.complete(complete(tickNumber, startedNanos, generated, deliveries));
                        } catch (RuntimeException e) {
                            done.completeExceptionally(e);
                        }
                    });
        } catch (RuntimeException e) {
            reportError("Tick " + tickNumber + " failed: " + e.getMessage(), e);
            done.completeExceptionally(e);
        }
    }

    private Generated generate() {
        Generated out = new Generated();
        synchronized (generationLock) {
            Instant now = wallClock.now();
            for (MachineCycleEngine engine : engines.values()) {
                MachineProfile profile = engine.profile();
                if (!profile.isReachable()) {
                    continue;
                }

                TickResult result;
                try {
                    result = engine.tick(now);
                } catch (RuntimeException e) {
                    reportError("Machine " + profile.machineId() + " failed to tick: " + e.getMessage(), e);
                    continue;
                }
                out.machinesTicked++;
                result.transition().ifPresent(observability::onPhaseTransition);

                for (SensorReading reading : result.readings()) {
                    for (ReadingFormatAdapter adapter : adapters) {
                        WireMessage message = adapter.adapt(profile, reading);
                        try {
                            validator.validate(message);
                        } catch (ValidationException e) {
                            out.validationFailures++;
                            metrics.recordValidationFailure();
                            observability.onValidationFailure(new ValidationFailureEvent(
                                    now, profile.machineId(), e.destination(), e.problems()));
                            continue;
                        }
                        out.bySchema.computeIfAbsent(adapter.schema(), s -> new ArrayList<>()).add(message);
                    }
                }
            }
        }
        return out;
    }

    private List<CompletableFuture<Delivery>> dispatch(Map<WireSchema, List<WireMessage>> bySchema) {
        List<CompletableFuture<Delivery>> deliveries = new ArrayList<>();
        for (List<WireMessage> messages : bySchema.values()) {
            if (batchSize > 1) {
                for (int from = 0; from < messages.size(); from += batchSize) {
                    List<WireMessage> chunk = List.copyOf(messages.subList(from, Math.min(from + batchSize, messages.size())));
                    String label = "batch[" + chunk.size() + "]";
                    deliveries.add(submit(label, chunk.size(), true, () -> publisher.publishBatch(chunk)));
                }
            } else {
                for (WireMessage message : messages) {
                    deliveries.add(submit(message.destination(), 1, false, () -> publisher.publish(message)));
                }
            }
        }
        return deliveries;
    }

    private CompletableFuture<Delivery> submit(String destination, int count, boolean batch, Runnable send) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> {
                        send.run();
                        return Delivery.delivered(destination, count, batch);
                    }, publishExecutor)
                    .exceptionally(t -> Delivery.failed(destination, count, batch, unwrap(t)));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(Delivery.failed(destination, count, batch, e));
        }
    }

    private TickCompletedEvent complete(long tickNumber,
                                        long startedNanos,
                                        Generated generated,
                                        List<CompletableFuture<Delivery>> deliveries) {
        int published = 0;
        int failures = 0;
        for (CompletableFuture<Delivery> f : deliveries) {
            Delivery d = f.join();
            if (d.failure == null) {
                published += d.count;
                metrics.recordPublished(d.count);
                if (d.batch) {
                    metrics.recordBatchSent();
                }
            } else {
                failures++;
                metrics.recordDeliveryFailure(d.destination + ": " + d.failure.getMessage());
                observability.onDeliveryFailure(new DeliveryFailureEvent(
                        wallClock.now(), d.destination, d.count, d.failure));
            }
        }
        metrics.recordTickCompleted(generated.machinesTicked);

        TickCompletedEvent event = new TickCompletedEvent(
                wallClock.now(),
                tickNumber,
                generated.machinesTicked,
                published,
                generated.validationFailures,
                failures,
                Duration.ofNanos(clock.nowNanos() - startedNanos));
        observability.onTickCompleted(event);
        return event;
    }

    private void drain(List<CompletableFuture<TickCompletedEvent>> pending) {
        if (pending.isEmpty()) {
            return;
        }
        log.info("Waiting up to {} ms for {} in-flight ticks", drainTimeout.toMillis(), pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("In-flight publishes did not drain within {} ms", drainTimeout.toMillis());
        } catch (ExecutionException e) {
            log.warn("In-flight tick failed while draining: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while draining in-flight publishes");
        }
    }

    private void reportError(String message, Throwable cause) {
        metrics.recordError(message);
        observability.onError(new SimulationErrorEvent(wallClock.now(), message, cause));
    }

    private int activeEngineCount() {
        int n = 0;
        for (MachineCycleEngine e : engines.values()) {
            if (e.profile().isReachable()) {
                n++;
            }
        }
        return n;
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    /**
     * Output of the generation phase of one tick.
     */
    private static final class Generated
    {
        final Map<WireSchema, List<WireMessage>> bySchema = new EnumMap<>(WireSchema.class);
        int machinesTicked;
        int validationFailures;
    }

    /**
     * Outcome of one publish or batch publish.
     */
    private record Delivery(String destination, int count, boolean batch, Throwable failure)
    {
        static Delivery delivered(String destination, int count, boolean batch) {
            return new Delivery(destination, count, batch, null);
        }

        static Delivery failed(String destination, int count, boolean batch, Throwable failure) {
            return new Delivery(destination, count, batch, failure);
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<MachineCycleEngine> engines = List.of();
        private List<ReadingFormatAdapter> adapters = List.of();
        private PublisherClient publisher;
        private int batchSize = 1;
        private Duration period;
        private Duration drainTimeout;
        private MonotonicClock clock;
        private WallClock wallClock;
        private MonotonicScheduler scheduler;
        private Executor publishExecutor;
        private SimulationObservabilitySink observability = NullObservabilitySink.INSTANCE;

        public Builder withEngines(List<MachineCycleEngine> engines) {
            this.engines = engines;
            return this;
        }

        public Builder withAdapters(List<ReadingFormatAdapter> adapters) {
            this.adapters = adapters;
            return this;
        }

        public Builder withPublisher(PublisherClient publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder withBatchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder withPeriod(Duration period) {
            this.period = period;
            return this;
        }

        public Builder withDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withPublishExecutor(Executor executor) {
            this.publishExecutor = executor;
            return this;
        }

        public Builder withObservabilitySink(SimulationObservabilitySink sink) {
            this.observability = sink;
            return this;
        }

        public SimulationScheduler build() {
            Objects.requireNonNull(engines, "engines");
            Objects.requireNonNull(adapters, "adapters");
            Objects.requireNonNull(publisher, "publisher");
            Objects.requireNonNull(period, "period");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(publishExecutor, "publishExecutor");
            Objects.requireNonNull(observability, "observability");
            if (adapters.isEmpty()) {
                throw new IllegalArgumentException("at least one adapter required");
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1");
            }
            if (period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("period must be positive");
            }
            return new SimulationScheduler(this);
        }
    }
}
