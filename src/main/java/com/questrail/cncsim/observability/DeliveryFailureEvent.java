package com.questrail.cncsim.observability;

import java.time.Instant;

/**
 * A delivery that failed after every retry.
 */
public record DeliveryFailureEvent(
    Instant timestamp,
    String destination,
    int messageCount,
    Throwable cause
) {
}
