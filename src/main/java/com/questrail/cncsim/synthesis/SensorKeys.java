package com.questrail.cncsim.synthesis;

import java.util.List;
import java.util.Locale;

/**
 * Hyphenated sensor keys emitted by {@link SensorSynthesizer}.
 */
public final class SensorKeys
{
    public static final String SPINDLE_SPEED = "spindle-speed";
    public static final String SPINDLE_LOAD = "spindle-load";
    public static final String FEEDRATE = "feedrate";
    public static final String VIBRATION = "vibration";
    public static final String TEMPERATURE = "temperature";
    public static final String CURRENT_TOOL = "current-tool";
    public static final String COOLANT_PRESSURE = "coolant-pressure";
    public static final String COOLANT_FLOW = "coolant-flow";
    public static final String OPERATIONAL = "operational";
    public static final String CYCLE_PHASE = "cycle-phase";
    public static final String PARTS_COUNT = "parts-count";
    public static final String EFFICIENCY = "efficiency";

    /** Axis labels in configuration order; the first three are linear. */
    public static final List<String> AXIS_LABELS = List.of("x", "y", "z", "a", "b", "c");

    public static final int LINEAR_AXES = 3;

    private SensorKeys() {
    }

    public static String position(String axisLabel) {
        return "position-" + axisLabel.toLowerCase(Locale.ROOT);
    }

    public static boolean isRotary(int axisIndex) {
        return axisIndex >= LINEAR_AXES;
    }
}
