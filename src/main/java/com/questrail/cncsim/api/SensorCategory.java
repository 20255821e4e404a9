package com.questrail.cncsim.api;

import java.util.Locale;

/**
 * Data-contract category a sensor key belongs to. Schemas that carry a
 * category segment in the destination address use {@link #segment()}.
 */
public enum SensorCategory
{
    SENSORS,
    STATUS,
    PRODUCTION;

    public String segment() {
        return name().toLowerCase(Locale.ROOT);
    }
}
