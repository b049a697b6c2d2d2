package net.slotwatch.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;

public record Monitoring(
        Long id,
        long ownerId,
        double coefficientMin,
        double coefficientMax,
        Set<Long> warehouseIds,
        Integer boxTypeId,
        int logisticsShoulderDays,
        LocalDate dateFrom,
        LocalDate dateTo,
        String orderRef,
        MonitoringStatus status,
        Set<LocalDate> failedDates,   // 예약 실패로 제외된 날짜(수정 시에만 초기화)
        Duration pollInterval,
        Instant lastCheckAt,
        Instant createdAt,
        Instant updatedAt
) {
    public Monitoring {
        if (coefficientMin < 0) throw new IllegalArgumentException("coefficientMin must be >= 0");
        if (coefficientMax < coefficientMin) throw new IllegalArgumentException("coefficientMax must be >= coefficientMin");
        if (warehouseIds == null || warehouseIds.isEmpty()) throw new IllegalArgumentException("warehouseIds must not be empty");
        if (logisticsShoulderDays < 0) throw new IllegalArgumentException("logisticsShoulderDays must be >= 0");
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo))
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        if (status == null) throw new IllegalArgumentException("status is required");
        if (createdAt == null) throw new IllegalArgumentException("createdAt is required");
        warehouseIds = Set.copyOf(warehouseIds);
        failedDates = failedDates == null ? Set.of() : Set.copyOf(failedDates);
    }

    public static Monitoring create(long ownerId, MonitoringConstraints c, Instant now) {
        return new Monitoring(null, ownerId,
                c.coefficientMin(), c.coefficientMax(), c.warehouseIds(), c.boxTypeId(),
                c.logisticsShoulderDays(), c.dateFrom(), c.dateTo(), c.orderRef(),
                MonitoringStatus.ACTIVE, Set.of(), c.pollInterval(), null, now, now);
    }

    public MonitoringConstraints constraints() {
        return new MonitoringConstraints(coefficientMin, coefficientMax, warehouseIds, boxTypeId,
                logisticsShoulderDays, dateFrom, dateTo, orderRef, pollInterval);
    }

    public boolean active() {
        return status == MonitoringStatus.ACTIVE;
    }

    public boolean hasOrderRef() {
        return orderRef != null && !orderRef.isBlank();
    }
}
