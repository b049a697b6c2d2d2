package net.slotwatch.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** attempt번째 시도가 실패한 뒤 기다릴 시간 */
    Duration nextBackoff(int attempt);

    static RetryPolicy fixed(Duration backoff) {
        return attempt -> backoff;
    }
}
