package com.questrail.cncsim.observability;

import com.questrail.cncsim.engine.PhaseTransition;

/**
 * No-op implementation of SimulationObservabilitySink.
 */
public final class NullObservabilitySink implements SimulationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(PhaseTransition transition) {}

    @Override
    public void onTickCompleted(TickCompletedEvent event) {}

    @Override
    public void onValidationFailure(ValidationFailureEvent event) {}

    @Override
    public void onDeliveryFailure(DeliveryFailureEvent event) {}

    @Override
    public void onError(SimulationErrorEvent event) {}
}
