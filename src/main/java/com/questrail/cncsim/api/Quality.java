package com.questrail.cncsim.api;

import java.util.Locale;

/**
 * Coarse validity tag attached to every synthesized value.
 */
public enum Quality
{
    GOOD,
    UNCERTAIN,
    BAD;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies {@code value} against an upper warning and alarm threshold:
     * above {@code alarm} is {@link #BAD}, above {@code warning} is
     * {@link #UNCERTAIN}, anything else {@link #GOOD}.
     */
    public static Quality ofUpperThresholds(double value, double warning, double alarm) {
        if (value > alarm) {
            return BAD;
        }
        if (value > warning) {
            return UNCERTAIN;
        }
        return GOOD;
    }
}
