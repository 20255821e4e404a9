package com.questrail.cncsim.observability;

import java.time.Instant;
import java.util.List;

/**
 * A formatted message rejected before publishing.
 */
public record ValidationFailureEvent(
    Instant timestamp,
    String machineId,
    String destination,
    List<String> problems
) {
    public ValidationFailureEvent {
        problems = List.copyOf(problems);
    }
}
