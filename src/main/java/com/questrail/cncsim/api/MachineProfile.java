package com.questrail.cncsim.api;

import java.util.Objects;

/**
 * MachineProfile
 * -----------------------------------------------------------------------------
 * Immutable identity, location and capability description of one machine.
 *
 * <p>Profiles are created once at startup from the fleet roster and never
 * change afterwards. All mutable simulation state lives in the engine that
 * owns the profile.</p>
 */
public record MachineProfile(
        String machineId,
        String displayName,
        String manufacturer,
        String model,
        LocationPath location,
        MachineCapabilities capabilities,
        OperationalClassification classification
) {
    public MachineProfile {
        Objects.requireNonNull(machineId, "machineId");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(manufacturer, "manufacturer");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(capabilities, "capabilities");
        Objects.requireNonNull(classification, "classification");
        if (machineId.isBlank()) {
            throw new IllegalArgumentException("machineId must not be blank");
        }
    }

    /**
     * Whether this machine takes part in telemetry generation.
     */
    public boolean isReachable() {
        return classification != OperationalClassification.UNREACHABLE;
    }
}
