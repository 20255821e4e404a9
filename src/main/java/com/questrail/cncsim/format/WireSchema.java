package com.questrail.cncsim.format;

/**
 * Wire-format conventions supported by the simulator.
 */
public enum WireSchema
{
    /**
     * Slash-separated hierarchical address with the full reading in the
     * payload. Configured as {@code uns}.
     */
    HIERARCHICAL("uns"),

    /**
     * Dotted {@code umh.v1} address with a minimal {@code {value, timestamp_ms}}
     * payload and out-of-band metadata. Configured as {@code umh}.
     */
    COMPACT("umh");

    private final String configName;

    WireSchema(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }
}
