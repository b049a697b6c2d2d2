package net.slotwatch.core.service;

public enum EpisodeOutcome {
    SUCCEEDED,
    TERMINAL_FAILURE,
    EXHAUSTED,
    /** 주문 번호나 세션이 없어 시도조차 하지 않음 */
    PRECONDITION_FAILED,
    /** 종료로 중단됨. 결과 미확정이라 날짜를 제외하지 않는다 */
    INTERRUPTED;

    public boolean blacklistsDate() {
        return this == TERMINAL_FAILURE || this == EXHAUSTED;
    }
}
