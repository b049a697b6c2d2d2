package net.slotwatch.core.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    @Test
    void firstGrantIsImmediate() throws Exception {
        RateLimiter limiter = new RateLimiter(Duration.ofSeconds(10));
        long start = System.nanoTime();
        limiter.acquire();
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
    }

    @Test
    void concurrentGrantsAreSpacedByMinInterval() throws Exception {
        Duration interval = Duration.ofMillis(100);
        RateLimiter limiter = new RateLimiter(interval);
        int callers = 5;

        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Long>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return limiter.acquire();
                }));
            }
            ready.await();
            go.countDown();

            List<Long> grants = new ArrayList<>();
            for (Future<Long> f : futures) grants.add(f.get(10, TimeUnit.SECONDS));
            Collections.sort(grants);

            for (int i = 1; i < grants.size(); i++) {
                long gap = grants.get(i) - grants.get(i - 1);
                assertTrue(gap >= interval.toNanos(), "gap " + gap + "ns is shorter than the interval");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void zeroIntervalNeverWaits() throws Exception {
        RateLimiter limiter = new RateLimiter(Duration.ZERO);
        long start = System.nanoTime();
        for (int i = 0; i < 100; i++) limiter.acquire();
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(1));
    }

    @Test
    void waitingCallerCanBeInterrupted() throws Exception {
        RateLimiter limiter = new RateLimiter(Duration.ofSeconds(30));
        limiter.acquire();

        Thread t = new Thread(() -> {
            try {
                limiter.acquire();
                fail("should not be granted");
            } catch (InterruptedException expected) {
                Thread.currentThread().interrupt();
            }
        });
        t.start();
        Thread.sleep(50);
        t.interrupt();
        t.join(5_000);
        assertFalse(t.isAlive());
    }

    @Test
    void negativeIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(Duration.ofMillis(-1)));
    }
}
