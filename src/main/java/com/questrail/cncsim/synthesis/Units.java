package com.questrail.cncsim.synthesis;

/**
 * Unit labels carried on readings.
 */
public final class Units
{
    public static final String RPM = "rpm";
    public static final String PERCENT = "percent";
    public static final String MILLIMETER = "mm";
    public static final String DEGREES = "degrees";
    public static final String MM_PER_MINUTE = "mm/min";
    public static final String MM_PER_SECOND = "mm/s";
    public static final String CELSIUS = "celsius";
    public static final String TOOL_NUMBER = "tool_number";
    public static final String BAR = "bar";
    public static final String LITERS_PER_MINUTE = "L/min";
    public static final String STATUS = "status";
    public static final String PHASE = "phase";
    public static final String PARTS = "parts";

    private Units() {
    }
}
