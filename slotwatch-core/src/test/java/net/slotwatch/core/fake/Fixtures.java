package net.slotwatch.core.fake;

import net.slotwatch.core.model.MonitoringConstraints;
import net.slotwatch.core.model.OwnerCredential;
import net.slotwatch.core.model.SlotOffer;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;

public final class Fixtures {
    public static final long OWNER = 42L;
    public static final Instant NOW = Instant.parse("2025-09-01T09:00:00Z");

    private Fixtures() {}

    /** min=0, max=2, 창고 5, 2025-09-10..2025-09-20 */
    public static MonitoringConstraints scenarioConstraints() {
        return new MonitoringConstraints(0, 2, Set.of(5L), null, 0,
                LocalDate.of(2025, 9, 10), LocalDate.of(2025, 9, 20), "WB-GI-1001", null);
    }

    public static SlotOffer offer(long warehouseId, String date, double coefficient) {
        return new SlotOffer(warehouseId, "Warehouse " + warehouseId, LocalDate.parse(date), coefficient,
                2, "Boxes", true);
    }

    public static OwnerCredential credential(long ownerId) {
        return new OwnerCredential(ownerId, "api-token-" + ownerId, "session-" + ownerId, null, NOW);
    }
}
