package com.questrail.cncsim.config;

import com.questrail.cncsim.api.LocationPath;
import com.questrail.cncsim.api.MachineCapabilities;
import com.questrail.cncsim.api.MachineProfile;
import com.questrail.cncsim.api.OperationalClassification;
import com.questrail.cncsim.api.WorkEnvelope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * FleetRoster
 * -----------------------------------------------------------------------------
 * Static description of the simulated shop floor.
 *
 * <p>The default roster is a ten-machine floor of mills, lathes and
 * multi-axis centres spread over four areas. Enterprise and site come from
 * configuration; everything else is fixed.</p>
 */
public final class FleetRoster
{
    private final List<MachineProfile> machines;

    public FleetRoster(List<MachineProfile> machines) {
        Objects.requireNonNull(machines, "machines");
        Set<String> ids = new HashSet<>();
        for (MachineProfile m : machines) {
            if (!ids.add(m.machineId())) {
                throw new IllegalArgumentException("Duplicate machine id: " + m.machineId());
            }
        }
        this.machines = List.copyOf(machines);
    }

    public List<MachineProfile> machines() {
        return machines;
    }

    public int size() {
        return machines.size();
    }

    public static FleetRoster defaultRoster(String enterprise, String site) {
        List<MachineProfile> m = new ArrayList<>();
        Floor floor = new Floor(enterprise, site);

        m.add(floor.machine("cnc-001", "Haas VF-2 Mill #1", "Haas", "VF-2", "machining", "cell-01",
                8100, 3, 15.0, 25400, "762x406x508", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-002", "Haas VF-2 Mill #2", "Haas", "VF-2", "machining", "cell-01",
                8100, 3, 15.0, 25400, "762x406x508", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-003", "DMG Mori NLX2500 Lathe #1", "DMG Mori", "NLX2500", "turning", "cell-02",
                4500, 2, 22.0, 30000, "400x800x350", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-004", "DMG Mori NLX2500 Lathe #2", "DMG Mori", "NLX2500", "turning", "cell-02",
                4500, 2, 22.0, 30000, "400x800x350", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-005", "Mazak Integrex i-300 Multi-Axis #1", "Mazak", "Integrex i-300", "multi-axis", "cell-03",
                6000, 5, 30.0, 36000, "500x850x450", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-006", "Mazak Integrex i-300 Multi-Axis #2", "Mazak", "Integrex i-300", "multi-axis", "cell-03",
                6000, 5, 30.0, 36000, "500x850x450", OperationalClassification.UNDER_MAINTENANCE));
        m.add(floor.machine("cnc-007", "Okuma Genos L250-E Lathe", "Okuma", "Genos L250-E", "turning", "cell-04",
                5000, 2, 18.5, 24000, "350x780x300", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-008", "Doosan DNM 500 Mill", "Doosan", "DNM 500", "machining", "cell-05",
                12000, 3, 11.0, 36000, "500x400x330", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-009", "Fanuc Robodrill α-T14iE Mill", "Fanuc", "Robodrill α-T14iE", "precision", "cell-06",
                24000, 3, 7.5, 60000, "350x250x220", OperationalClassification.ACTIVE));
        m.add(floor.machine("cnc-010", "Mori Seiki NV5000 DCG Mill", "Mori Seiki", "NV5000 DCG", "precision", "cell-06",
                15000, 5, 22.0, 50000, "560x510x460", OperationalClassification.UNREACHABLE));

        return new FleetRoster(m);
    }

    /**
     * Shared enterprise and site of the built-in roster rows.
     */
    private record Floor(String enterprise, String site)
    {
        MachineProfile machine(String id, String displayName, String manufacturer, String model,
                               String area, String cell,
                               int maxRpm, int axes, double powerKw, int traverse, String envelope,
                               OperationalClassification classification) {
            MachineCapabilities caps = new MachineCapabilities(
                    maxRpm, axes, axes, true, true, powerKw, traverse, WorkEnvelope.parse(envelope));
            return new MachineProfile(id, displayName, manufacturer, model,
                    new LocationPath(enterprise, site, area, cell), caps, classification);
        }
    }
}
