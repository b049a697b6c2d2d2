package net.slotwatch.core.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OwnerSessionLeasesTest {

    @Test
    void sameOwnerIsExclusive_differentOwnersAreIndependent() throws Exception {
        OwnerSessionLeases leases = new OwnerSessionLeases();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(6);
        try {
            for (int i = 0; i < 6; i++) {
                pool.execute(() -> {
                    try (OwnerSessionLeases.Lease lease = leases.acquire(7L)) {
                        int n = inside.incrementAndGet();
                        maxInside.accumulateAndGet(n, Math::max);
                        Thread.sleep(20);
                        inside.decrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            try (OwnerSessionLeases.Lease other = leases.acquire(8L)) {
                assertEquals(8L, other.ownerId());
                assertTrue(leases.isLeased(8L));
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(1, maxInside.get());
            assertFalse(leases.isLeased(7L));
        } finally {
            pool.shutdownNow();
        }
    }
}
