package com.questrail.cncsim.format;

import com.questrail.cncsim.api.TelemetrySimulatorException;

import java.util.List;

/**
 * Indicates that a formatted message violates its schema's rules and must
 * not be published. Lists every problem found, not only the first.
 */
public final class ValidationException extends TelemetrySimulatorException
{
    private final String destination;
    private final List<String> problems;

    public ValidationException(String destination, List<String> problems) {
        super("Invalid message for '" + destination + "': " + String.join("; ", problems));
        this.destination = destination;
        this.problems = List.copyOf(problems);
    }

    public String destination() {
        return destination;
    }

    public List<String> problems() {
        return problems;
    }
}
