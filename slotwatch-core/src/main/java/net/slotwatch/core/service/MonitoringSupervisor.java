package net.slotwatch.core.service;

import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.MonitoringRepository;
import net.slotwatch.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * ACTIVE 모니터링 집합과 실행 중인 워커 집합을 맞춘다.
 * 레지스트리와 retiring 집합은 이 클래스만 소유한다.
 */
public final class MonitoringSupervisor implements RetirementGuard {
    private static final Logger log = LoggerFactory.getLogger(MonitoringSupervisor.class);

    public static final String WORKER_THREAD_PREFIX = "slotwatch-worker-";

    private final MonitoringRepository monitorings;
    private final TxRunner tx;
    private final WorkerFactory workers;
    private final ExecutorService pool;
    private final Clock clock;
    private final Duration failureBackoff;
    private final Duration shutdownTimeout;

    private final Map<Long, MonitoringWorker> registry = new ConcurrentHashMap<>();
    private final Set<Long> retiring = ConcurrentHashMap.newKeySet();
    private volatile boolean started;
    private volatile Instant backoffUntil;

    public MonitoringSupervisor(MonitoringRepository monitorings,
                                TxRunner tx,
                                WorkerFactory workers,
                                ExecutorService pool,
                                Clock clock,
                                Duration failureBackoff,
                                Duration shutdownTimeout) {
        this.monitorings = monitorings;
        this.tx = tx;
        this.workers = workers;
        this.pool = pool;
        this.clock = clock;
        this.failureBackoff = failureBackoff;
        this.shutdownTimeout = shutdownTimeout;
    }

    public void start() {
        started = true;
        log.info("Supervisor started");
    }

    public boolean isStarted() {
        return started;
    }

    /** 스케줄러가 주기적으로 호출. 시작 전이거나 실패 백오프 중이면 아무것도 하지 않는다. */
    public void tick() {
        if (!started) return;
        Instant now = clock.now();
        if (backoffUntil != null && now.isBefore(backoffUntil)) return;
        try {
            ReconcileReport r = reconcile();
            backoffUntil = null;
            if (r.changed()) log.info("Reconciled: {}", r);
            else log.debug("Reconciled: {}", r);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            // 기존 워커는 그대로 두고 다음 시도만 미룬다
            backoffUntil = now.plus(failureBackoff);
            log.error("Reconciliation failed, next attempt not before {}", backoffUntil, e);
        }
    }

    public synchronized ReconcileReport reconcile() throws Exception {
        List<Monitoring> active = tx.required(monitorings::findAllActive);
        Set<Long> activeIds = active.stream().map(Monitoring::id).collect(Collectors.toSet());

        // 더 이상 ACTIVE가 아닌 retiring 표시는 정리
        retiring.retainAll(activeIds);

        int cancelled = 0;
        for (Map.Entry<Long, MonitoringWorker> e : registry.entrySet()) {
            MonitoringWorker w = e.getValue();
            if (!activeIds.contains(e.getKey()) && !w.isCancelled()) {
                w.cancel();
                cancelled++;
                log.info("Monitoring {} no longer active, worker cancelled", e.getKey());
            }
        }

        int started = 0;
        int skipped = 0;
        for (Long id : activeIds) {
            if (registry.containsKey(id)) continue;
            if (retiring.contains(id)) {
                skipped++;
                continue;
            }
            // 로드 이후 상태가 바뀌었을 수 있으므로 다시 확인
            Optional<Monitoring> fresh = tx.required(() -> monitorings.findById(id));
            if (fresh.isEmpty() || !fresh.get().active()) continue;
            if (spawn(id)) started++;
        }
        return new ReconcileReport(started, cancelled, skipped, registry.size());
    }

    private boolean spawn(long id) {
        MonitoringWorker worker = workers.create(id, this);
        registry.put(id, worker);
        try {
            pool.execute(() -> runWorker(id, worker));
            log.info("Worker spawned for monitoring {}", id);
            return true;
        } catch (RejectedExecutionException e) {
            registry.remove(id, worker);
            log.warn("Worker for monitoring {} rejected, pool is shut down", id);
            return false;
        }
    }

    private void runWorker(long id, MonitoringWorker worker) {
        Thread t = Thread.currentThread();
        String previous = t.getName();
        t.setName(WORKER_THREAD_PREFIX + id);
        try {
            worker.run();
        } finally {
            registry.remove(id, worker);
            t.setName(previous);
        }
    }

    @Override
    public void markRetiring(long monitoringId) {
        retiring.add(monitoringId);
    }

    public boolean isRetiring(long monitoringId) {
        return retiring.contains(monitoringId);
    }

    public boolean isRunning(long monitoringId) {
        return registry.containsKey(monitoringId);
    }

    public Set<Long> runningIds() {
        return Set.copyOf(registry.keySet());
    }

    public Optional<MonitoringWorker> worker(long monitoringId) {
        return Optional.ofNullable(registry.get(monitoringId));
    }

    /** 모든 워커를 취소하고 풀이 비워질 때까지 제한 시간만큼 기다린다. */
    public void shutdown() {
        started = false;
        registry.values().forEach(MonitoringWorker::cancel);
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop within {}, interrupting", shutdownTimeout);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Supervisor stopped");
    }
}
