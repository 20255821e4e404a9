package com.questrail.cncsim.synthesis;

import com.questrail.cncsim.api.CyclePhase;
import com.questrail.cncsim.api.MachineCapabilities;
import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.Quality;
import com.questrail.cncsim.api.SensorCategory;
import com.questrail.cncsim.api.SensorReading;
import com.questrail.cncsim.api.WorkEnvelope;
import com.questrail.cncsim.engine.CycleState;
import com.questrail.cncsim.engine.MachineSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SensorSynthesizer
 * =============================================================================
 * Turns one machine snapshot into the full set of sensor readings for one
 * instant.
 *
 * <h2>Purity</h2>
 * {@link #synthesize} reads only its arguments. Variation that would look
 * random comes from {@link DeterministicNoise} keyed by the machine's noise
 * seed, the sensor key and {@code now}; smooth drift comes from sinusoids of
 * wall-clock time with periods between 5 and 15 seconds. Calling it twice with
 * the same arguments yields equal readings.
 *
 * <h2>Reading order</h2>
 * spindle-speed, spindle-load, one position per configured axis, feedrate,
 * vibration, temperature, current-tool, coolant-pressure and coolant-flow
 * (only with a coolant system), operational, cycle-phase, parts-count,
 * efficiency.
 */
public final class SensorSynthesizer
{
    static final double SPEED_PERIOD_S = 10.0;
    static final double LOAD_PERIOD_S = 15.0;
    static final double AXIS_PERIOD_S = 8.0;
    static final double FEED_PERIOD_S = 12.0;
    static final double VIBRATION_PERIOD_S = 5.0;
    static final double PRESSURE_PERIOD_S = 5.0;
    static final double FLOW_PERIOD_S = 7.0;

    public static final double LOAD_UNCERTAIN_ABOVE = 95.0;
    public static final double VIBRATION_WARNING = 3.0;
    public static final double VIBRATION_ALARM = 5.0;
    public static final double TEMPERATURE_WARNING = 75.0;
    public static final double TEMPERATURE_ALARM = 90.0;
    public static final double TOOL_WEAR_UNCERTAIN_ABOVE = 0.8;
    public static final double MIN_OPERATING_PRESSURE = 2.0;
    public static final double NOMINAL_PRESSURE = 4.0;
    public static final double NOMINAL_FLOW = 20.0;
    public static final double TARGET_EFFICIENCY = 75.0;

    public List<SensorReading> synthesize(MachineProfile profile, MachineSnapshot snapshot, Instant now) {
        Context c = new Context(profile, snapshot, now);
        List<SensorReading> readings = new ArrayList<>();

        readings.add(spindleSpeed(c));
        readings.add(spindleLoad(c));
        int axes = profile.capabilities().axisCount();
        for (int i = 0; i < axes; i++) {
            readings.add(axisPosition(c, i));
        }
        readings.add(feedrate(c));
        readings.add(vibration(c));
        readings.add(temperature(c));
        readings.add(currentTool(c));
        if (profile.capabilities().coolantSystem()) {
            readings.add(coolantPressure(c));
            readings.add(coolantFlow(c));
        }
        readings.add(operational(c));
        readings.add(cyclePhase(c));
        readings.add(partsCount(c));
        readings.add(efficiency(c));
        return readings;
    }

    // ---------------------------------------------------------------------
    // Sensors
    // ---------------------------------------------------------------------

    private SensorReading spindleSpeed(Context c) {
        int max = c.caps().maxSpindleRpm();
        double rpm;
        if (c.phase() == CyclePhase.MACHINING) {
            double base = max * (0.3 + c.noise(SensorKeys.SPINDLE_SPEED) * 0.6);
            rpm = base + DeterministicNoise.oscillation(c.now, SPEED_PERIOD_S) * base * 0.1;
        } else if (c.phase().isPositioning()) {
            rpm = max * 0.1;
        } else {
            rpm = 0;
        }

        Map<String, Object> meta = c.meta();
        meta.put("max_rpm", max);
        return c.reading(SensorKeys.SPINDLE_SPEED, SensorCategory.SENSORS,
                Math.max(0L, Math.round(rpm)), Quality.GOOD, Units.RPM, meta);
    }

    private SensorReading spindleLoad(Context c) {
        double load;
        if (c.phase() == CyclePhase.MACHINING) {
            load = 30 + c.noise(SensorKeys.SPINDLE_LOAD) * 50
                    + DeterministicNoise.oscillation(c.now, LOAD_PERIOD_S) * 20;
        } else if (c.phase().isPositioning()) {
            load = 5 + c.noise(SensorKeys.SPINDLE_LOAD) * 10;
        } else {
            load = 0;
        }

        Quality quality = load > LOAD_UNCERTAIN_ABOVE ? Quality.UNCERTAIN : Quality.GOOD;
        Map<String, Object> meta = c.meta();
        meta.put("power_rating_kw", c.caps().spindlePowerKw());
        return c.reading(SensorKeys.SPINDLE_LOAD, SensorCategory.SENSORS,
                clamp(round(load, 1), 0, 100), quality, Units.PERCENT, meta);
    }

    private SensorReading axisPosition(Context c, int axisIndex) {
        String label = SensorKeys.AXIS_LABELS.get(axisIndex);
        boolean rotary = SensorKeys.isRotary(axisIndex);
        WorkEnvelope envelope = c.caps().workEnvelope();

        // fraction of travel, 0 = home
        double fraction;
        if (c.phase() == CyclePhase.MACHINING) {
            fraction = 0.5 + DeterministicNoise.oscillation(c.now, AXIS_PERIOD_S, axisIndex) * 0.3;
        } else if (c.phase().isPositioning()) {
            fraction = axisIndex == 0 ? 0.1 : 0.5;
        } else {
            fraction = 0.0;
        }

        double value;
        double maxTravel;
        if (rotary) {
            maxTravel = 360.0;
            value = fraction == 0.0 ? 0.0 : fraction * 360.0 - 180.0;
        } else {
            maxTravel = envelope.travel(axisIndex);
            value = fraction * maxTravel;
        }

        Map<String, Object> meta = c.meta();
        meta.put("axis", label.toUpperCase());
        meta.put("max_travel", maxTravel);
        return c.reading(SensorKeys.position(label), SensorCategory.SENSORS,
                round(value, 2), Quality.GOOD, rotary ? Units.DEGREES : Units.MILLIMETER, meta);
    }

    private SensorReading feedrate(Context c) {
        int rapid = c.caps().rapidTraverseMmPerMin();
        double feed;
        if (c.phase() == CyclePhase.MACHINING) {
            feed = 100 + c.noise(SensorKeys.FEEDRATE) * 1500
                    + DeterministicNoise.oscillation(c.now, FEED_PERIOD_S) * 300;
        } else if (c.phase().isPositioning()) {
            feed = rapid * 0.1;
        } else {
            feed = 0;
        }

        Map<String, Object> meta = c.meta();
        meta.put("rapid_traverse", rapid);
        return c.reading(SensorKeys.FEEDRATE, SensorCategory.SENSORS,
                Math.max(0L, Math.round(feed)), Quality.GOOD, Units.MM_PER_MINUTE, meta);
    }

    private SensorReading vibration(Context c) {
        double baseline = c.snapshot.vibrationBaseline();
        double u = c.noise(SensorKeys.VIBRATION);
        double vibration = baseline + switch (c.phase()) {
            case MACHINING -> u * 2.0 + DeterministicNoise.oscillation(c.now, VIBRATION_PERIOD_S) * 0.5;
            case ERROR -> u * 5.0;
            default -> u * 0.2;
        };

        Map<String, Object> meta = c.meta();
        meta.put("baseline", baseline);
        meta.put("threshold_warning", VIBRATION_WARNING);
        meta.put("threshold_alarm", VIBRATION_ALARM);
        return c.reading(SensorKeys.VIBRATION, SensorCategory.SENSORS,
                round(vibration, 2),
                Quality.ofUpperThresholds(vibration, VIBRATION_WARNING, VIBRATION_ALARM),
                Units.MM_PER_SECOND, meta);
    }

    private SensorReading temperature(Context c) {
        double baseline = c.snapshot.temperatureBaseline();
        double u = c.noise(SensorKeys.TEMPERATURE);
        double temperature = baseline + switch (c.phase()) {
            case MACHINING -> u * 20 + 10;
            case ERROR -> u * 30;
            default -> u * 5;
        };

        Map<String, Object> meta = c.meta();
        meta.put("baseline", baseline);
        meta.put("threshold_warning", TEMPERATURE_WARNING);
        meta.put("threshold_alarm", TEMPERATURE_ALARM);
        return c.reading(SensorKeys.TEMPERATURE, SensorCategory.SENSORS,
                round(temperature, 1),
                Quality.ofUpperThresholds(temperature, TEMPERATURE_WARNING, TEMPERATURE_ALARM),
                Units.CELSIUS, meta);
    }

    private SensorReading currentTool(Context c) {
        int tool = c.cycle().currentTool(c.now);
        double wear = c.snapshot.wear(tool);

        Map<String, Object> meta = c.meta();
        meta.put("tool_wear_percent", Math.round(wear * 100));
        meta.put("tool_life_remaining", Math.round((1 - wear) * 100));
        return c.reading(SensorKeys.CURRENT_TOOL, SensorCategory.SENSORS,
                tool, wear > TOOL_WEAR_UNCERTAIN_ABOVE ? Quality.UNCERTAIN : Quality.GOOD,
                Units.TOOL_NUMBER, meta);
    }

    private SensorReading coolantPressure(Context c) {
        double u = c.noise(SensorKeys.COOLANT_PRESSURE);
        double pressure;
        if (c.phase() == CyclePhase.MACHINING) {
            pressure = 3.5 + u * 1.0 + DeterministicNoise.oscillation(c.now, PRESSURE_PERIOD_S) * 0.2;
        } else if (c.phase().isPositioning()) {
            pressure = 2.0 + u * 0.5;
        } else {
            pressure = 0.5 + u * 0.3;
        }

        Quality quality = c.phase() == CyclePhase.MACHINING && pressure < MIN_OPERATING_PRESSURE
                ? Quality.BAD
                : Quality.GOOD;
        Map<String, Object> meta = c.meta();
        meta.put("min_operating_pressure", MIN_OPERATING_PRESSURE);
        meta.put("nominal_pressure", NOMINAL_PRESSURE);
        return c.reading(SensorKeys.COOLANT_PRESSURE, SensorCategory.SENSORS,
                round(pressure, 1), quality, Units.BAR, meta);
    }

    private SensorReading coolantFlow(Context c) {
        double u = c.noise(SensorKeys.COOLANT_FLOW);
        double flow;
        if (c.phase() == CyclePhase.MACHINING) {
            flow = 15 + u * 10 + DeterministicNoise.oscillation(c.now, FLOW_PERIOD_S) * 3;
        } else if (c.phase().isPositioning()) {
            flow = 5 + u * 3;
        } else {
            flow = 1 + u * 2;
        }

        Map<String, Object> meta = c.meta();
        meta.put("nominal_flow", NOMINAL_FLOW);
        return c.reading(SensorKeys.COOLANT_FLOW, SensorCategory.SENSORS,
                round(flow, 1), Quality.GOOD, Units.LITERS_PER_MINUTE, meta);
    }

    private SensorReading operational(Context c) {
        String status = OperationalStatusVocabulary.statusFor(c.profile.classification(), c.phase());

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("base_status", c.profile.classification().statusWord());
        meta.put("cycle_phase", c.phase().wireName());
        meta.put("uptime_hours", Math.round(c.runtimeSeconds() / 3600.0));
        return c.reading(SensorKeys.OPERATIONAL, SensorCategory.STATUS,
                status, Quality.GOOD, Units.STATUS, meta);
    }

    private SensorReading cyclePhase(Context c) {
        CycleState cycle = c.cycle();
        long elapsed = Math.round(cycle.elapsedSeconds(c.now));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("elapsed_seconds", elapsed);
        if (cycle.isUnbounded()) {
            meta.put("unbounded", true);
        } else {
            long total = Math.round(cycle.plannedSeconds());
            meta.put("remaining_seconds", Math.max(0L, total - elapsed));
            meta.put("total_duration", total);
            meta.put("progress_percent", total == 0 ? 100L : Math.min(100L, Math.round(elapsed * 100.0 / total)));
        }
        return c.reading(SensorKeys.CYCLE_PHASE, SensorCategory.STATUS,
                cycle.phase().wireName(), Quality.GOOD, Units.PHASE, meta);
    }

    private SensorReading partsCount(Context c) {
        long parts = c.snapshot.partsProduced();
        double hours = c.runtimeSeconds() / 3600.0;

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("shift_start", c.snapshot.runtimeStart().toString());
        meta.put("parts_per_hour", hours > 0 ? round(parts / hours, 1) : 0.0);
        return c.reading(SensorKeys.PARTS_COUNT, SensorCategory.PRODUCTION,
                parts, Quality.GOOD, Units.PARTS, meta);
    }

    private SensorReading efficiency(Context c) {
        double runtime = c.runtimeSeconds();
        double machining = c.snapshot.machiningSeconds();
        double efficiency = runtime > 0 ? Math.min(100.0, machining / runtime * 100.0) : 0.0;

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("machining_time_seconds", Math.round(machining));
        meta.put("total_runtime_seconds", Math.round(runtime));
        meta.put("target_efficiency", TARGET_EFFICIENCY);
        meta.put("current_phase", c.phase().wireName());
        return c.reading(SensorKeys.EFFICIENCY, SensorCategory.PRODUCTION,
                round(efficiency, 1), Quality.GOOD, Units.PERCENT, meta);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Arguments of one {@link #synthesize} call, bundled for the per-sensor
     * functions.
     */
    private static final class Context
    {
        final MachineProfile profile;
        final MachineSnapshot snapshot;
        final Instant now;

        Context(MachineProfile profile, MachineSnapshot snapshot, Instant now) {
            this.profile = profile;
            this.snapshot = snapshot;
            this.now = now;
        }

        MachineCapabilities caps() {
            return profile.capabilities();
        }

        CycleState cycle() {
            return snapshot.cycle();
        }

        CyclePhase phase() {
            return snapshot.cycle().phase();
        }

        double noise(String channel) {
            return DeterministicNoise.uniform(snapshot.noiseSeed(), channel, now);
        }

        double runtimeSeconds() {
            Duration d = Duration.between(snapshot.runtimeStart(), now);
            return d.isNegative() ? 0.0 : d.toMillis() / 1000.0;
        }

        /** Metadata pre-populated with the current phase. */
        Map<String, Object> meta() {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("phase", phase().wireName());
            return meta;
        }

        SensorReading reading(String key, SensorCategory category, Object value,
                              Quality quality, String unit, Map<String, Object> metadata) {
            return new SensorReading(profile.machineId(), key, category, value, quality, unit, now, metadata);
        }
    }
}
