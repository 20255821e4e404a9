package com.questrail.cncsim.api;

/**
 * Machine profiles shared by tests.
 */
public final class TestProfiles {

    public static final LocationPath SHOP = new LocationPath("acme", "plant1", "machining", "cell-01");

    private TestProfiles() {
    }

    /** Three-axis mill, 8100 rpm, with coolant. */
    public static MachineProfile mill(OperationalClassification classification) {
        return new MachineProfile("cnc-001", "Haas VF-2 Mill #1", "Haas", "VF-2", SHOP,
                new MachineCapabilities(8100, 3, 3, true, true, 15.0, 25400, WorkEnvelope.parse("762x406x508")),
                classification);
    }

    public static MachineProfile mill() {
        return mill(OperationalClassification.ACTIVE);
    }

    /** Two-axis lathe without a coolant system. */
    public static MachineProfile dryLathe() {
        return new MachineProfile("cnc-003", "Lathe", "DMG Mori", "NLX2500",
                new LocationPath("acme", "plant1", "turning", "cell-02"),
                new MachineCapabilities(4500, 2, 2, true, false, 22.0, 30000, WorkEnvelope.parse("400x800x350")),
                OperationalClassification.ACTIVE);
    }

    /** Five-axis machining centre: X, Y, Z linear, A and B rotary. */
    public static MachineProfile fiveAxis() {
        return new MachineProfile("cnc-005", "Integrex", "Mazak", "Integrex i-300",
                new LocationPath("acme", "plant1", "multi-axis", "cell-03"),
                new MachineCapabilities(6000, 5, 5, true, true, 30.0, 36000, WorkEnvelope.parse("500x850x450")),
                OperationalClassification.ACTIVE);
    }
}
