package net.slotwatch.core.model;

/** 예약 동작에 넘기는 인증 세션 */
public record SessionHandle(long ownerId, String apiToken, String sessionData) {
    @Override
    public String toString() {
        return "SessionHandle{ownerId=" + ownerId + "}";
    }
}
