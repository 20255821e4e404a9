package com.questrail.cncsim.observability;

import com.questrail.cncsim.engine.PhaseTransition;

/**
 * Receives simulation observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from the timer thread and from publish executor
 * threads; implementations must be thread-safe.</p>
 */
public interface SimulationObservabilitySink {
    /**
     * Called when a machine changes cycle phase.
     * @param transition the transition details
     */
    void onPhaseTransition(PhaseTransition transition);

    /**
     * Called once per tick, after every publish of that tick has completed.
     * @param event per-tick totals
     */
    void onTickCompleted(TickCompletedEvent event);

    /**
     * Called when a formatted message is rejected and dropped.
     * @param event the rejected message and its problems
     */
    void onValidationFailure(ValidationFailureEvent event);

    /**
     * Called when a message or batch could not be delivered after all retries.
     * @param event the failed destination and cause
     */
    void onDeliveryFailure(DeliveryFailureEvent event);

    /**
     * Called for unexpected failures outside the per-message pipeline.
     * @param event the error event
     */
    void onError(SimulationErrorEvent event);
}
