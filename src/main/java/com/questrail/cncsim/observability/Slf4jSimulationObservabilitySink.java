package com.questrail.cncsim.observability;

import com.questrail.cncsim.engine.PhaseTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SimulationObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSimulationObservabilitySink implements SimulationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSimulationObservabilitySink.class);

    @Override
    public void onPhaseTransition(PhaseTransition transition) {
        log.info("Machine {}: Phase {} -> {} (planned {}s)",
            transition.machineId(),
            transition.from().wireName(),
            transition.to().wireName(),
            transition.plannedDuration().toSeconds());
    }

    @Override
    public void onTickCompleted(TickCompletedEvent event) {
        log.debug("Tick {}: {} machines, {} published, {} invalid, {} failed in {} ms",
            event.tickNumber(),
            event.machinesTicked(),
            event.messagesPublished(),
            event.validationFailures(),
            event.deliveryFailures(),
            event.elapsed().toMillis());
    }

    @Override
    public void onValidationFailure(ValidationFailureEvent event) {
        log.warn("Dropped invalid message for {} ({}): {}",
            event.machineId(), event.destination(), event.problems());
    }

    @Override
    public void onDeliveryFailure(DeliveryFailureEvent event) {
        log.error("Delivery failed for {} ({} messages): {}",
            event.destination(), event.messageCount(),
            event.cause() != null ? event.cause().getMessage() : "unknown");
    }

    @Override
    public void onError(SimulationErrorEvent event) {
        log.error("Simulation Error: {}", event.message(), event.cause());
    }
}
