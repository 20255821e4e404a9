package com.questrail.cncsim.api;

import java.util.Locale;

/**
 * Static operational classification of a machine, fixed for the lifetime of
 * the process.
 *
 * <p>The classification decides the initial cycle phase of a machine and
 * whether it takes part in telemetry generation at all.</p>
 */
public enum OperationalClassification
{
    /** Normal production machine; cycles through all phases. */
    ACTIVE("operational"),

    /** Starts in a one-hour maintenance window, then cycles normally. */
    UNDER_MAINTENANCE("maintenance"),

    /** Parked in idle forever and excluded from generation. */
    UNREACHABLE("offline");

    private final String statusWord;

    OperationalClassification(String statusWord) {
        this.statusWord = statusWord;
    }

    /**
     * Word used for this classification in the operational-status vocabulary.
     */
    public String statusWord() {
        return statusWord;
    }

    /**
     * Parses either the enum name or the status word, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown words
     */
    public static OperationalClassification parse(String text) {
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (OperationalClassification c : values()) {
            if (c.name().toLowerCase(Locale.ROOT).equals(normalized) || c.statusWord.equals(normalized)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown operational classification: " + text);
    }
}
