package com.questrail.cncsim.observability;

import java.time.Instant;

/**
 * An error outside the per-message pipeline, such as a machine whose tick
 * threw.
 */
public record SimulationErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
