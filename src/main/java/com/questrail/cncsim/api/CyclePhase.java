package com.questrail.cncsim.api;

import java.util.Locale;

/**
 * Phase of a machine's operational cycle. Exactly one phase is active at any
 * instant.
 */
public enum CyclePhase
{
    IDLE,
    LOADING,
    MACHINING,
    UNLOADING,
    MAINTENANCE,
    ERROR;

    /**
     * Lower-case name as it appears in payloads and metadata.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Loading and unloading share positioning behaviour in most sensors.
     */
    public boolean isPositioning() {
        return this == LOADING || this == UNLOADING;
    }
}
