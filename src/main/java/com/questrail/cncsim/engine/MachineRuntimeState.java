package com.questrail.cncsim.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * MachineRuntimeState
 * -----------------------------------------------------------------------------
 * Mutable counters and fixed baselines of one machine.
 *
 * <h2>Ownership</h2>
 * Owned exclusively by a single {@link MachineCycleEngine} and mutated only
 * from its {@code tick}. Mutators are package-private for that reason; other
 * packages see the state through {@link MachineSnapshot}.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>baselines and the noise seed are drawn once and never change</li>
 *   <li>tool wear only increases and stays within [0,1]</li>
 *   <li>parts produced and machining seconds only increase</li>
 * </ul>
 */
public final class MachineRuntimeState
{
    /** Tools in the magazine. */
    public static final int TOOL_COUNT = 20;

    /** Upper bound of the wear a tool may already carry at startup. */
    public static final double MAX_INITIAL_WEAR = 0.3;

    private final double vibrationBaseline;
    private final double temperatureBaseline;
    private final long noiseSeed;
    private final Instant runtimeStart;
    private final Map<Integer, Double> toolWear = new TreeMap<>();

    private long partsProduced;
    private double machiningSeconds;
    private Instant lastTick;

    MachineRuntimeState(double vibrationBaseline,
                        double temperatureBaseline,
                        long noiseSeed,
                        Map<Integer, Double> initialWear,
                        Instant runtimeStart) {
        this.vibrationBaseline = vibrationBaseline;
        this.temperatureBaseline = temperatureBaseline;
        this.noiseSeed = noiseSeed;
        this.runtimeStart = Objects.requireNonNull(runtimeStart, "runtimeStart");
        this.lastTick = runtimeStart;
        initialWear.forEach((tool, wear) -> toolWear.put(tool, clampWear(wear)));
    }

    /**
     * Draws baselines, noise seed and initial tool wear from {@code random}.
     */
    static MachineRuntimeState draw(RandomSource random, Instant runtimeStart) {
        double vibration = random.uniform(0.1, 0.6);
        double temperature = random.uniform(45.0, 55.0);
        long seed = random.nextLong();
        Map<Integer, Double> wear = new TreeMap<>();
        for (int tool = 1; tool <= TOOL_COUNT; tool++) {
            wear.put(tool, random.uniform(0.0, MAX_INITIAL_WEAR));
        }
        return new MachineRuntimeState(vibration, temperature, seed, wear, runtimeStart);
    }

    public double vibrationBaseline() {
        return vibrationBaseline;
    }

    public double temperatureBaseline() {
        return temperatureBaseline;
    }

    public long noiseSeed() {
        return noiseSeed;
    }

    public Instant runtimeStart() {
        return runtimeStart;
    }

    public long partsProduced() {
        return partsProduced;
    }

    public double machiningSeconds() {
        return machiningSeconds;
    }

    public Instant lastTick() {
        return lastTick;
    }

    public double wear(int tool) {
        return toolWear.getOrDefault(tool, 0.0);
    }

    public Map<Integer, Double> toolWear() {
        return Collections.unmodifiableMap(new TreeMap<>(toolWear));
    }

    // ---------------------------------------------------------------------
    // Engine-only mutators
    // ---------------------------------------------------------------------

    void incrementPartsProduced() {
        partsProduced++;
    }

    void addMachiningSeconds(double seconds) {
        if (seconds > 0) {
            machiningSeconds += seconds;
        }
    }

    void addWear(int tool, double delta) {
        if (delta > 0) {
            toolWear.merge(tool, delta, (a, b) -> clampWear(a + b));
        }
    }

    void markTick(Instant now) {
        if (now.isAfter(lastTick)) {
            lastTick = now;
        }
    }

    private static double clampWear(double wear) {
        return Math.max(0.0, Math.min(1.0, wear));
    }
}
