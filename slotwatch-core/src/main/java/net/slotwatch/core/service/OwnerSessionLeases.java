package net.slotwatch.core.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 소유자별 예약 세션 독점 임차.
 * 같은 소유자의 두 모니터링이 동시에 세션을 쓰지 않도록 예약 에피소드 동안 잡는다.
 */
public final class OwnerSessionLeases {
    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Lease acquire(long ownerId) throws InterruptedException {
        ReentrantLock lock = locks.computeIfAbsent(ownerId, k -> new ReentrantLock());
        lock.lockInterruptibly();
        return new Lease(ownerId, lock);
    }

    public boolean isLeased(long ownerId) {
        ReentrantLock lock = locks.get(ownerId);
        return lock != null && lock.isLocked();
    }

    public static final class Lease implements AutoCloseable {
        private final long ownerId;
        private final ReentrantLock lock;

        private Lease(long ownerId, ReentrantLock lock) {
            this.ownerId = ownerId;
            this.lock = lock;
        }

        public long ownerId() {
            return ownerId;
        }

        @Override
        public void close() {
            lock.unlock();
        }
    }
}
