package net.slotwatch.core.model;

import java.time.LocalDate;

/** 업스트림 계수 조회 결과 한 건 (필터 전) */
public record SlotOffer(
        long warehouseId,
        String warehouseName,
        LocalDate date,
        double coefficient,      // 음수 = 업스트림에서 닫힌 슬롯
        Integer boxTypeId,
        String boxTypeName,
        boolean unloadAllowed
) {}
