package net.slotwatch.core.service;

/** 예약 성공으로 종료되는 모니터링을 재기동 대상에서 빼도록 표시한다. */
@FunctionalInterface
public interface RetirementGuard {
    void markRetiring(long monitoringId);
}
