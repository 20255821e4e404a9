package com.questrail.cncsim.api;

import java.util.Objects;

/**
 * MachineCapabilities
 * -----------------------------------------------------------------------------
 * Static capability set of a machine as printed on its data sheet.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code axisCount} is within [{@value #MIN_AXES}, {@value #MAX_AXES}]</li>
 *   <li>{@code simultaneousAxes} does not exceed {@code axisCount}</li>
 *   <li>speeds and power are strictly positive</li>
 * </ul>
 */
public record MachineCapabilities(
        int maxSpindleRpm,
        int axisCount,
        int simultaneousAxes,
        boolean toolChanger,
        boolean coolantSystem,
        double spindlePowerKw,
        int rapidTraverseMmPerMin,
        WorkEnvelope workEnvelope
) {
    public static final int MIN_AXES = 2;
    public static final int MAX_AXES = 6;

    public MachineCapabilities {
        Objects.requireNonNull(workEnvelope, "workEnvelope");
        if (axisCount < MIN_AXES || axisCount > MAX_AXES) {
            throw new IllegalArgumentException("axisCount must be within [2,6]: " + axisCount);
        }
        if (simultaneousAxes < 1 || simultaneousAxes > axisCount) {
            throw new IllegalArgumentException("simultaneousAxes must be within [1," + axisCount + "]: " + simultaneousAxes);
        }
        if (maxSpindleRpm <= 0) {
            throw new IllegalArgumentException("maxSpindleRpm must be positive");
        }
        if (!(spindlePowerKw > 0)) {
            throw new IllegalArgumentException("spindlePowerKw must be positive");
        }
        if (rapidTraverseMmPerMin <= 0) {
            throw new IllegalArgumentException("rapidTraverseMmPerMin must be positive");
        }
    }
}
