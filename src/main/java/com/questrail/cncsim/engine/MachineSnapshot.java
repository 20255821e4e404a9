package com.questrail.cncsim.engine;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copy of everything sensor synthesis needs from an engine at one
 * instant.
 *
 * <p>Handing synthesis a snapshot instead of the live state keeps it a pure
 * function: the same snapshot and {@code now} always yield the same
 * readings.</p>
 */
public record MachineSnapshot(
        CycleState cycle,
        long partsProduced,
        Map<Integer, Double> toolWear,
        double vibrationBaseline,
        double temperatureBaseline,
        long noiseSeed,
        double machiningSeconds,
        Instant runtimeStart
) {
    public MachineSnapshot {
        Objects.requireNonNull(cycle, "cycle");
        Objects.requireNonNull(runtimeStart, "runtimeStart");
        toolWear = Map.copyOf(toolWear);
    }

    public double wear(int tool) {
        return toolWear.getOrDefault(tool, 0.0);
    }
}
