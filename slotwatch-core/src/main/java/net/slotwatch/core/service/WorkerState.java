package net.slotwatch.core.service;

import net.slotwatch.core.model.CandidateSlot;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 워커 하나가 소유하는 메모리 상태: 창고별 최선 슬롯과 예약 시도 횟수.
 * 워커 스레드에서만 변경한다.
 */
public final class WorkerState {
    private final Map<Long, CandidateSlot> bestByWarehouse = new HashMap<>();
    private int attempts;

    public synchronized Map<Long, CandidateSlot> bestSnapshot() {
        return Map.copyOf(bestByWarehouse);
    }

    public synchronized Optional<CandidateSlot> best(long warehouseId) {
        return Optional.ofNullable(bestByWarehouse.get(warehouseId));
    }

    public synchronized void recordBest(CandidateSlot slot) {
        bestByWarehouse.put(slot.warehouseId(), slot);
    }

    public synchronized void clearBest() {
        bestByWarehouse.clear();
    }

    public synchronized int nextAttempt() {
        return ++attempts;
    }

    public synchronized int attempts() {
        return attempts;
    }

    public synchronized void resetAttempts() {
        attempts = 0;
    }

    public synchronized void clear() {
        bestByWarehouse.clear();
        attempts = 0;
    }
}
