package net.slotwatch.core.model;

import java.time.Instant;

public record OwnerCredential(
        long ownerId,
        String apiToken,          // 계수 조회용
        String sessionData,       // 예약 세션(불투명 값), null = 세션 없음
        Instant sessionExpiresAt, // null = 만료 없음
        Instant updatedAt
) {
    public boolean hasApiToken() {
        return apiToken != null && !apiToken.isBlank();
    }

    public boolean hasSession() {
        return sessionData != null && !sessionData.isBlank();
    }

    public boolean sessionExpired(Instant now) {
        return sessionExpiresAt != null && !sessionExpiresAt.isAfter(now);
    }
}
