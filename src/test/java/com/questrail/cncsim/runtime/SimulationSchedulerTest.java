package com.questrail.cncsim.runtime;

import com.questrail.cncsim.api.CyclePhase;
import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.SensorReading;
import com.questrail.cncsim.config.FleetRoster;
import com.questrail.cncsim.engine.MachineCycleEngine;
import com.questrail.cncsim.engine.PhaseTransition;
import com.questrail.cncsim.engine.SplittableRandomSource;
import com.questrail.cncsim.format.CompactSchemaAdapter;
import com.questrail.cncsim.format.HierarchicalSchemaAdapter;
import com.questrail.cncsim.format.ReadingFormatAdapter;
import com.questrail.cncsim.format.WireMessage;
import com.questrail.cncsim.format.WireSchema;
import com.questrail.cncsim.observability.DeliveryFailureEvent;
import com.questrail.cncsim.observability.RecordingObservabilitySink;
import com.questrail.cncsim.observability.TickCompletedEvent;
import com.questrail.cncsim.observability.ValidationFailureEvent;
import com.questrail.cncsim.publish.PublisherClient;
import com.questrail.cncsim.publish.RetryPolicy;
import com.questrail.cncsim.synthesis.SensorSynthesizer;
import com.questrail.cncsim.time.DeterministicScheduler;
import com.questrail.cncsim.time.ManualMonotonicClock;
import com.questrail.cncsim.time.ManualWallClock;
import com.questrail.cncsim.time.RecordingSleeper;
import com.questrail.cncsim.transport.ConnectionException;
import com.questrail.cncsim.transport.FakeTelemetrySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SimulationSchedulerTest
 * -----------------------------------------------------------------------------
 * Drives the scheduler with a manual clock, a deterministic timer and a
 * same-thread publish executor over the built-in ten-machine roster.
 *
 * <p>Nine machines are reachable and together emit 136 readings per tick.</p>
 */
class SimulationSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");
    private static final Duration PERIOD = Duration.ofSeconds(3);
    private static final int READINGS_PER_TICK = 136;

    private ManualMonotonicClock clock;
    private ManualWallClock wallClock;
    private DeterministicScheduler timer;
    private FakeTelemetrySink sink;
    private RecordingObservabilitySink observability;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        wallClock = new ManualWallClock(T0);
        timer = new DeterministicScheduler(clock);
        sink = new FakeTelemetrySink();
        observability = new RecordingObservabilitySink();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static List<MachineCycleEngine> engines() {
        SensorSynthesizer synthesizer = new SensorSynthesizer();
        List<MachineCycleEngine> engines = new ArrayList<>();
        long seed = 1;
        for (MachineProfile profile : FleetRoster.defaultRoster("acme", "plant1").machines()) {
            engines.add(new MachineCycleEngine(profile, new SplittableRandomSource(seed++), synthesizer, T0));
        }
        return engines;
    }

    private SimulationScheduler.Builder builder() {
        return SimulationScheduler.builder()
                .withEngines(engines())
                .withAdapters(List.of(new HierarchicalSchemaAdapter()))
                .withPublisher(new PublisherClient(sink, RetryPolicy.defaults(), new RecordingSleeper()))
                .withPeriod(PERIOD)
                .withClock(clock)
                .withWallClock(wallClock)
                .withScheduler(timer)
                .withPublishExecutor(Runnable::run)
                .withObservabilitySink(observability);
    }

    /** Advances both clocks by one period and fires due timers. */
    private int elapsePeriod() {
        clock.advance(PERIOD);
        wallClock.advance(PERIOD);
        return timer.runDueTasks();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void firstTickFiresOnePeriodAfterStart() {
        SimulationScheduler s = builder().build();
        s.start();

        assertEquals(0, timer.runDueTasks());
        assertTrue(sink.published().isEmpty());
        assertEquals(1, sink.connectCount());

        assertEquals(1, elapsePeriod());
        assertEquals(READINGS_PER_TICK, sink.published().size());
        assertEquals(1, timer.pendingCount());
    }

    @Test
    void timerKeepsFixedCadence() {
        SimulationScheduler s = builder().build();
        s.start();

        for (int i = 0; i < 4; i++) {
            elapsePeriod();
        }

        assertEquals(4, s.metrics().ticksCompleted());
        assertEquals(4L * READINGS_PER_TICK, s.metrics().totalMessagesPublished());
    }

    @Test
    void startingTwiceIsRejected() {
        SimulationScheduler s = builder().build();
        s.start();

        assertThrows(SimulationAlreadyRunningException.class, s::start);
        assertEquals(1, timer.pendingCount());
        assertEquals(1, sink.connectCount());

        assertEquals(1, elapsePeriod());
        assertEquals(READINGS_PER_TICK, sink.published().size());
        assertEquals(1, s.metrics().ticksCompleted());
    }

    @Test
    void connectFailureLeavesSchedulerStopped() {
        sink.failConnect(true);
        SimulationScheduler s = builder().build();

        assertThrows(ConnectionException.class, s::start);
        assertFalse(s.isRunning());
        assertEquals(0, timer.pendingCount());
        assertEquals(1, sink.disconnectCount());
    }

    @Test
    void stopCancelsTimerAndDisconnects() {
        SimulationScheduler s = builder().build();
        s.start();
        elapsePeriod();

        s.stop();

        assertFalse(s.isRunning());
        assertEquals(0, timer.pendingCount());
        assertEquals(1, sink.disconnectCount());

        sink.clear();
        assertEquals(0, elapsePeriod());
        assertTrue(sink.published().isEmpty());
    }

    @Test
    void stopWhenNotRunningIsANoOp() {
        SimulationScheduler s = builder().build();

        s.stop();

        assertEquals(0, sink.disconnectCount());
    }

    @Test
    void manualTickRequiresRunningSimulation() {
        SimulationScheduler s = builder().build();

        assertThrows(SimulationNotRunningException.class, s::runTick);
    }

    // ---------------------------------------------------------------------
    // Tick content
    // ---------------------------------------------------------------------

    @Test
    void unreachableMachineIsSkipped() {
        SimulationScheduler s = builder().build();
        s.start();

        TickCompletedEvent event = s.runTick().join();

        assertEquals(9, event.machinesTicked());
        assertEquals(READINGS_PER_TICK, event.messagesPublished());
        assertTrue(sink.published().stream().noneMatch(m -> m.destination().contains("cnc-010")));
        assertEquals(9, s.metrics().activeMachines());
    }

    @Test
    void allMessagesOfATickShareOneTimestamp() {
        SimulationScheduler s = builder().build();
        s.start();
        wallClock.advance(Duration.ofSeconds(7));

        s.runTick().join();

        long expected = T0.plusSeconds(7).toEpochMilli();
        assertTrue(sink.published().stream().allMatch(m -> m.timestampMs() == expected));
    }

    @Test
    void bothSchemasDoubleTheOutput() {
        SimulationScheduler s = builder()
                .withAdapters(List.of(new HierarchicalSchemaAdapter(), new CompactSchemaAdapter()))
                .build();
        s.start();

        s.runTick().join();

        Map<WireSchema, Long> bySchema = sink.published().stream()
                .collect(Collectors.groupingBy(WireMessage::schema, Collectors.counting()));
        assertEquals(2L * READINGS_PER_TICK, sink.published().size());
        assertEquals(READINGS_PER_TICK, bySchema.get(WireSchema.HIERARCHICAL));
        assertEquals(READINGS_PER_TICK, bySchema.get(WireSchema.COMPACT));
    }

    @Test
    void batchesAreChunkedPerSchema() {
        SimulationScheduler s = builder().withBatchSize(50).build();
        s.start();

        s.runTick().join();

        List<List<WireMessage>> batches = sink.batches();
        assertEquals(3, batches.size());
        assertEquals(50, batches.get(0).size());
        assertEquals(50, batches.get(1).size());
        assertEquals(36, batches.get(2).size());
        assertEquals(3, s.metrics().batchesSent());
        assertEquals(READINGS_PER_TICK, s.metrics().totalMessagesPublished());
    }

    @Test
    void invalidMessagesAreCountedAndDropped() {
        HierarchicalSchemaAdapter valid = new HierarchicalSchemaAdapter();
        ReadingFormatAdapter losesEfficiencyValue = new ReadingFormatAdapter() {
            @Override
            public WireSchema schema() {
                return WireSchema.HIERARCHICAL;
            }

            @Override
            public WireMessage adapt(MachineProfile profile, SensorReading reading) {
                WireMessage m = valid.adapt(profile, reading);
                if (!reading.sensorKey().equals("efficiency")) {
                    return m;
                }
                return new WireMessage(m.schema(), m.destination(), null, m.timestampMs(), m.payload(), m.metadata());
            }
        };
        SimulationScheduler s = builder().withAdapters(List.of(losesEfficiencyValue)).build();
        s.start();

        TickCompletedEvent event = s.runTick().join();

        assertEquals(9, event.validationFailures());
        assertEquals(READINGS_PER_TICK - 9, event.messagesPublished());
        assertEquals(9, s.metrics().validationFailures());

        List<ValidationFailureEvent> failures = observability.eventsOfType(ValidationFailureEvent.class);
        assertEquals(9, failures.size());
        assertEquals(List.of("value missing"), failures.get(0).problems());
    }

    @Test
    void deliveryFailuresNeverAbortTheTick() {
        sink.failAlways(true);
        SimulationScheduler s = builder().build();
        s.start();

        assertEquals(1, elapsePeriod());

        SimulationMetrics m = s.metrics();
        assertEquals(0, m.totalMessagesPublished());
        assertEquals(READINGS_PER_TICK, m.deliveryFailures());
        assertEquals(MetricsAccumulator.MAX_RECENT_ERRORS, m.recentErrors().size());
        assertEquals(1, m.ticksCompleted());
        assertEquals(READINGS_PER_TICK, observability.eventsOfType(DeliveryFailureEvent.class).size());
        assertEquals(3 * READINGS_PER_TICK, sink.attempts());

        // the timer is still armed
        assertTrue(s.isRunning());
        assertEquals(1, timer.pendingCount());
    }

    @Test
    void transientFailureIsRetriedWithinTheTick() {
        sink.failFirst(2);
        SimulationScheduler s = builder().build();
        s.start();

        TickCompletedEvent event = s.runTick().join();

        assertEquals(READINGS_PER_TICK, event.messagesPublished());
        assertEquals(0, event.deliveryFailures());
    }

    @Test
    void phaseTransitionsAreReported() {
        SimulationScheduler s = builder().build();
        s.engine("cnc-001").forcePhase(CyclePhase.MACHINING, Duration.ofSeconds(1), T0);
        s.start();
        wallClock.advance(PERIOD);

        s.runTick().join();

        List<PhaseTransition> transitions = observability.eventsOfType(PhaseTransition.class);
        PhaseTransition t = transitions.stream()
                .filter(x -> x.machineId().equals("cnc-001"))
                .findFirst()
                .orElseThrow();
        assertEquals(CyclePhase.MACHINING, t.from());
        assertEquals(CyclePhase.UNLOADING, t.to());
        assertEquals(1, s.engine("cnc-001").runtimeState().partsProduced());
    }

    @Test
    void rateReflectsUptime() {
        SimulationScheduler s = builder().build();
        s.start();

        elapsePeriod();

        assertEquals(45.33, s.metrics().messagesPerSecond());
        assertEquals(3, s.metrics().uptimeSeconds());
    }

    @Test
    void restartKeepsRateConsistentWithTotal() {
        SimulationScheduler s = builder().build();
        s.start();
        for (int i = 0; i < 100; i++) {
            elapsePeriod();
        }
        assertEquals(45.33, s.metrics().messagesPerSecond());

        s.stop();
        clock.advance(Duration.ofMinutes(10));
        s.start();
        elapsePeriod();

        SimulationMetrics m = s.metrics();
        assertEquals(101L * READINGS_PER_TICK, m.totalMessagesPublished());
        assertEquals(303, m.uptimeSeconds());
        assertEquals(45.33, m.messagesPerSecond());
        assertEquals(2, sink.connectCount());
    }

    @Test
    void tickEventIsEmittedOncePerTick() {
        SimulationScheduler s = builder().build();
        s.start();

        elapsePeriod();
        elapsePeriod();

        List<TickCompletedEvent> ticks = observability.eventsOfType(TickCompletedEvent.class);
        assertEquals(2, ticks.size());
        assertEquals(1, ticks.get(0).tickNumber());
        assertEquals(2, ticks.get(1).tickNumber());
    }

    @Test
    void builderRejectsMissingPieces() {
        assertThrows(NullPointerException.class, () -> SimulationScheduler.builder().withPeriod(PERIOD).build());
        assertThrows(IllegalArgumentException.class, () -> builder().withAdapters(List.of()).build());
        assertThrows(IllegalArgumentException.class, () -> builder().withBatchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder().withPeriod(Duration.ZERO).build());
    }
}
