package com.questrail.cncsim.engine;

import com.questrail.cncsim.api.CyclePhase;
import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.SensorReading;
import com.questrail.cncsim.synthesis.SensorSynthesizer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MachineCycleEngine
 * =============================================================================
 * Owns the operational cycle of one machine: its phase state machine, tool
 * wear and production counters.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE → LOADING → MACHINING → UNLOADING ─┬→ IDLE         (85%)
 *    ↑                                      ├→ MAINTENANCE  (10%) → IDLE
 *    └──────────────────────────────────────┴→ ERROR        (5%)  → IDLE
 * </pre>
 * A phase self-loops while its elapsed time is below the planned duration.
 * The first tick at or after the planned end performs the transition and
 * draws the next planned duration from {@link PhaseDurations}. At most one
 * transition happens per tick.
 *
 * <h2>Time</h2>
 * The engine is pull-driven: it never reads a clock. Callers pass {@code now}
 * into {@link #tick(Instant)}. A {@code now} older than the previous tick is
 * clamped to the previous tick, so generated timestamps never go backwards.
 * Ticking twice at the same instant neither advances the phase twice nor
 * accumulates wear twice.
 *
 * <h2>Tool wear</h2>
 * While machining, the tool in the spindle wears by
 * {@code seconds of cutting / }{@value #TOOL_LIFE_SECONDS}, i.e. a tool is worn
 * out after eight hours of cutting. Wear is never reset.
 *
 * <h2>Threading</h2>
 * Not thread-safe. The simulation scheduler is the only caller and ticks
 * engines from a single timer thread.
 */
public final class MachineCycleEngine
{
    /** Seconds of cutting that take a tool from no wear to full wear. */
    public static final double TOOL_LIFE_SECONDS = 8 * 3600.0;

    private final MachineProfile profile;
    private final RandomSource random;
    private final SensorSynthesizer synthesizer;
    private final MachineRuntimeState runtime;

    private CycleState cycle;

    /**
     * Creates an engine and draws its per-machine baselines from {@code random}.
     *
     * @param profile     machine described by this engine
     * @param random      random source owned by this engine from now on
     * @param synthesizer sensor synthesis functions
     * @param createdAt   instant the machine joins the simulation
     */
    public MachineCycleEngine(MachineProfile profile,
                              RandomSource random,
                              SensorSynthesizer synthesizer,
                              Instant createdAt) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.random = Objects.requireNonNull(random, "random");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        Objects.requireNonNull(createdAt, "createdAt");

        this.runtime = MachineRuntimeState.draw(random, createdAt);
        this.cycle = initialCycle(createdAt);
    }

    private CycleState initialCycle(Instant now) {
        switch (profile.classification()) {
            case UNREACHABLE:
                return CycleState.unbounded(CyclePhase.IDLE, now);
            case UNDER_MAINTENANCE:
                return new CycleState(CyclePhase.MAINTENANCE, now, PhaseDurations.INITIAL_MAINTENANCE);
            case ACTIVE:
            default:
                return new CycleState(CyclePhase.IDLE, now, PhaseDurations.IDLE.sample(random));
        }
    }

    public MachineProfile profile() {
        return profile;
    }

    public String machineId() {
        return profile.machineId();
    }

    public CycleState cycleState() {
        return cycle;
    }

    public MachineRuntimeState runtimeState() {
        return runtime;
    }

    /**
     * Advances the cycle to {@code now} and synthesizes the readings for that
     * instant.
     */
    public TickResult tick(Instant requested) {
        Objects.requireNonNull(requested, "now");

        Instant previous = runtime.lastTick();
        Instant now = requested.isBefore(previous) ? previous : requested;

        accumulateMachining(previous, now);

        Optional<PhaseTransition> transition = Optional.empty();
        if (cycle.isComplete(now)) {
            transition = Optional.of(advance(now));
        }

        runtime.markTick(now);
        List<SensorReading> readings = synthesizer.synthesize(profile, snapshot(), now);
        return new TickResult(readings, transition);
    }

    /**
     * Replaces the current phase regardless of the state machine. Intended for
     * operators and tests that need a machine in a particular phase.
     */
    public void forcePhase(CyclePhase phase, Duration plannedDuration, Instant now) {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(plannedDuration, "plannedDuration");
        Objects.requireNonNull(now, "now");
        this.cycle = new CycleState(phase, now, plannedDuration);
    }

    /**
     * Immutable view of the current state.
     */
    public MachineSnapshot snapshot() {
        return new MachineSnapshot(
                cycle,
                runtime.partsProduced(),
                runtime.toolWear(),
                runtime.vibrationBaseline(),
                runtime.temperatureBaseline(),
                runtime.noiseSeed(),
                runtime.machiningSeconds(),
                runtime.runtimeStart()
        );
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    /**
     * Credits the cutting time between the previous tick and {@code now} to
     * the machining counters and the current tool. Only the part of the
     * interval that overlaps the machining phase counts.
     */
    private void accumulateMachining(Instant previous, Instant now) {
        if (cycle.phase() != CyclePhase.MACHINING) {
            return;
        }
        Instant from = previous.isBefore(cycle.startTime()) ? cycle.startTime() : previous;
        Instant end = cycle.plannedEnd();
        Instant to = end != null && end.isBefore(now) ? end : now;
        if (!to.isAfter(from)) {
            return;
        }

        double seconds = Duration.between(from, to).toMillis() / 1000.0;
        runtime.addMachiningSeconds(seconds);
        runtime.addWear(cycle.currentTool(to), seconds / TOOL_LIFE_SECONDS);
    }

    private PhaseTransition advance(Instant now) {
        CyclePhase from = cycle.phase();
        CycleState next = switch (from) {
            case IDLE -> new CycleState(CyclePhase.LOADING, now, PhaseDurations.LOADING.sample(random));
            case LOADING -> new CycleState(CyclePhase.MACHINING, now, PhaseDurations.MACHINING.sample(random));
            case MACHINING -> {
                runtime.incrementPartsProduced();
                yield new CycleState(CyclePhase.UNLOADING, now, PhaseDurations.UNLOADING.sample(random));
            }
            case UNLOADING -> afterUnloading(now);
            case MAINTENANCE, ERROR -> new CycleState(CyclePhase.IDLE, now, PhaseDurations.IDLE.sample(random));
        };
        this.cycle = next;
        return new PhaseTransition(profile.machineId(), from, next.phase(), now, next.plannedDuration());
    }

    private CycleState afterUnloading(Instant now) {
        double draw = random.nextDouble();
        if (draw < PhaseDurations.ERROR_BRANCH_BELOW) {
            return new CycleState(CyclePhase.ERROR, now, PhaseDurations.ERROR.sample(random));
        }
        if (draw < PhaseDurations.MAINTENANCE_BRANCH_BELOW) {
            return new CycleState(CyclePhase.MAINTENANCE, now, PhaseDurations.MAINTENANCE.sample(random));
        }
        return new CycleState(CyclePhase.IDLE, now, PhaseDurations.IDLE.sample(random));
    }
}
