package net.slotwatch.core.service;

import java.time.Duration;

public record WorkerSettings(
        Duration pollInterval,      // 모니터링에 주기가 없을 때
        Duration rateLimitPause,    // 429 이후 최소 휴지
        Duration errorPause         // 예기치 못한 오류 후 휴지
) {
    public static WorkerSettings defaults() {
        return new WorkerSettings(Duration.ofSeconds(12), Duration.ofSeconds(120), Duration.ofSeconds(5));
    }
}
