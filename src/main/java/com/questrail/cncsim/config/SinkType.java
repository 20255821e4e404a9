package com.questrail.cncsim.config;

import java.util.Locale;

/**
 * Transport a simulation delivers to.
 */
public enum SinkType
{
    /** MQTT broker via Eclipse Paho. */
    MQTT,
    /** HTTP ingestion API via Netty. */
    HTTP,
    /** Dry run: messages are only logged. */
    LOG;

    public static SinkType parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sink type: " + text, e);
        }
    }
}
