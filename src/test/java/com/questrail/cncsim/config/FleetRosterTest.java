package com.questrail.cncsim.config;

import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.OperationalClassification;
import com.questrail.cncsim.api.TestProfiles;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FleetRosterTest {

    @Test
    void defaultRosterHasTenMachines() {
        FleetRoster roster = FleetRoster.defaultRoster("acme", "plant1");

        assertEquals(10, roster.size());
        List<String> ids = roster.machines().stream().map(MachineProfile::machineId).collect(Collectors.toList());
        assertEquals("cnc-001", ids.get(0));
        assertEquals("cnc-010", ids.get(9));
    }

    @Test
    void defaultRosterUsesConfiguredEnterpriseAndSite() {
        for (MachineProfile m : FleetRoster.defaultRoster("acme", "north").machines()) {
            assertEquals("acme", m.location().enterprise());
            assertEquals("north", m.location().site());
        }
    }

    @Test
    void defaultRosterClassifications() {
        FleetRoster roster = FleetRoster.defaultRoster("acme", "plant1");

        long active = roster.machines().stream()
                .filter(m -> m.classification() == OperationalClassification.ACTIVE)
                .count();
        assertEquals(8, active);
        assertEquals(OperationalClassification.UNDER_MAINTENANCE, find(roster, "cnc-006").classification());
        assertEquals(OperationalClassification.UNREACHABLE, find(roster, "cnc-010").classification());
        assertFalse(find(roster, "cnc-010").isReachable());
    }

    @Test
    void defaultRosterCapabilities() {
        FleetRoster roster = FleetRoster.defaultRoster("acme", "plant1");

        assertEquals(24000, find(roster, "cnc-009").capabilities().maxSpindleRpm());
        assertEquals(5, find(roster, "cnc-005").capabilities().axisCount());
        assertEquals(2, find(roster, "cnc-003").capabilities().axisCount());
        assertTrue(roster.machines().stream().allMatch(m -> m.capabilities().coolantSystem()));
    }

    @Test
    void rejectsDuplicateIds() {
        assertThrows(IllegalArgumentException.class,
                () -> new FleetRoster(List.of(TestProfiles.mill(), TestProfiles.mill())));
    }

    @Test
    void machinesListIsImmutable() {
        FleetRoster roster = new FleetRoster(List.of(TestProfiles.mill()));

        assertThrows(UnsupportedOperationException.class, () -> roster.machines().add(TestProfiles.dryLathe()));
    }

    private static MachineProfile find(FleetRoster roster, String id) {
        return roster.machines().stream().filter(m -> m.machineId().equals(id)).findFirst().orElseThrow();
    }
}
