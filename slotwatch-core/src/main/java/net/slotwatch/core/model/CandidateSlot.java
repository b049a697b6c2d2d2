package net.slotwatch.core.model;

import java.time.LocalDate;

/** 필터를 통과한 슬롯. 사이클 안에서만 유효하다. */
public record CandidateSlot(
        long warehouseId,
        String warehouseName,
        LocalDate date,
        double coefficient,
        Integer boxTypeId,
        boolean unloadAllowed
) {
    public static CandidateSlot of(SlotOffer o) {
        return new CandidateSlot(o.warehouseId(), o.warehouseName(), o.date(), o.coefficient(),
                o.boxTypeId(), o.unloadAllowed());
    }

    public String label() {
        return warehouseName == null || warehouseName.isBlank()
                ? "#" + warehouseId
                : warehouseName + " (#" + warehouseId + ")";
    }
}
