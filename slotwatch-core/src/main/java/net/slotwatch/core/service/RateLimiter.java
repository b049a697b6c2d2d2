package net.slotwatch.core.service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 모든 워커가 공유하는 호출 간격 게이트.
 * 직전 허가로부터 minInterval이 지나야 다음 호출을 허가한다. 공정성은 보장하지 않는다.
 */
public final class RateLimiter {
    private final long minIntervalNanos;
    private final ReentrantLock lock = new ReentrantLock();
    private long lastGrantNanos;
    private boolean granted;

    public RateLimiter(Duration minInterval) {
        if (minInterval == null || minInterval.isNegative())
            throw new IllegalArgumentException("minInterval must be >= 0");
        this.minIntervalNanos = minInterval.toNanos();
    }

    /** 허가될 때까지 대기. 허가 시각(System.nanoTime)을 반환한다. */
    public long acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (granted) {
                long wait;
                while ((wait = lastGrantNanos + minIntervalNanos - System.nanoTime()) > 0) {
                    TimeUnit.NANOSECONDS.sleep(wait);
                }
            }
            lastGrantNanos = System.nanoTime();
            granted = true;
            return lastGrantNanos;
        } finally {
            lock.unlock();
        }
    }

    public Duration minInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
