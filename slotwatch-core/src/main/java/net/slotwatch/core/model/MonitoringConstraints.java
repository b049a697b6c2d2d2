package net.slotwatch.core.model;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Set;

/**
 * 사용자가 편집 가능한 모니터링 조건.
 * 생성/수정 시 그대로 {@link Monitoring}에 복사된다.
 */
public record MonitoringConstraints(
        double coefficientMin,
        double coefficientMax,
        Set<Long> warehouseIds,
        Integer boxTypeId,          // null = 박스 타입 무관
        int logisticsShoulderDays,
        LocalDate dateFrom,         // null = createdAt + shoulder
        LocalDate dateTo,           // null = 상한 없음
        String orderRef,            // null 허용, 예약 시점에 검사
        Duration pollInterval       // null = 기본 주기
) {
    public MonitoringConstraints {
        if (coefficientMin < 0) throw new IllegalArgumentException("coefficientMin must be >= 0");
        if (coefficientMax < coefficientMin) throw new IllegalArgumentException("coefficientMax must be >= coefficientMin");
        if (warehouseIds == null || warehouseIds.isEmpty()) throw new IllegalArgumentException("warehouseIds must not be empty");
        if (logisticsShoulderDays < 0) throw new IllegalArgumentException("logisticsShoulderDays must be >= 0");
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo))
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        if (pollInterval != null && (pollInterval.isZero() || pollInterval.isNegative()))
            throw new IllegalArgumentException("pollInterval must be positive");
        warehouseIds = Set.copyOf(warehouseIds);
    }
}
