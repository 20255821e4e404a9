package com.questrail.cncsim.synthesis;

import com.questrail.cncsim.api.CyclePhase;
import com.questrail.cncsim.api.OperationalClassification;

/**
 * Maps a machine's classification and current phase to the status word
 * reported on the {@code operational} sensor.
 *
 * <p>Only {@link OperationalClassification#ACTIVE} machines refine their status
 * by phase. Machines under maintenance or unreachable report their
 * classification word unchanged.</p>
 */
public final class OperationalStatusVocabulary
{
    public static final String RUNNING = "running";
    public static final String SETUP = "setup";
    public static final String IDLE = "idle";
    public static final String ERROR = "error";
    public static final String MAINTENANCE = "maintenance";

    private OperationalStatusVocabulary() {
    }

    public static String statusFor(OperationalClassification classification, CyclePhase phase) {
        if (classification != OperationalClassification.ACTIVE) {
            return classification.statusWord();
        }
        switch (phase) {
            case MACHINING:
                return RUNNING;
            case LOADING:
            case UNLOADING:
                return SETUP;
            case ERROR:
                return ERROR;
            case MAINTENANCE:
                return MAINTENANCE;
            case IDLE:
            default:
                return IDLE;
        }
    }
}
