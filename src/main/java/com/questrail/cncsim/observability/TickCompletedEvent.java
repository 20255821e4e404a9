package com.questrail.cncsim.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Totals of one completed tick.
 */
public record TickCompletedEvent(
    Instant timestamp,
    long tickNumber,
    int machinesTicked,
    int messagesPublished,
    int validationFailures,
    int deliveryFailures,
    Duration elapsed
) {
}
