package com.questrail.cncsim.runtime;

import java.util.List;

/**
 * Point-in-time readout of a simulation's delivery metrics.
 *
 * @param totalMessagesPublished messages delivered since start (batched messages count individually)
 * @param messagesPerSecond      {@code totalMessagesPublished / uptimeSeconds}, two decimals
 * @param activeMachines         machines ticked by the most recent completed tick
 * @param uptimeSeconds          whole seconds since start
 * @param recentErrors           at most the ten most recent errors, oldest first
 * @param batchesSent            batches delivered since start
 * @param validationFailures     messages dropped by validation
 * @param ticksCompleted         ticks whose publishes have all completed
 * @param deliveryFailures       messages or batches that failed after every retry
 */
public record SimulationMetrics(
        long totalMessagesPublished,
        double messagesPerSecond,
        int activeMachines,
        long uptimeSeconds,
        List<String> recentErrors,
        long batchesSent,
        long validationFailures,
        long ticksCompleted,
        long deliveryFailures
) {
    public SimulationMetrics {
        recentErrors = List.copyOf(recentErrors);
    }
}
