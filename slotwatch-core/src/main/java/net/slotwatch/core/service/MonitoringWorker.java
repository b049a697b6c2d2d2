package net.slotwatch.core.service;

import net.slotwatch.core.exception.UpstreamAuthException;
import net.slotwatch.core.exception.UpstreamException;
import net.slotwatch.core.exception.UpstreamRateLimitedException;
import net.slotwatch.core.model.CandidateSlot;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.MonitoringConstraints;
import net.slotwatch.core.model.MonitoringStatus;
import net.slotwatch.core.model.SlotOffer;
import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.CoefficientQuery;
import net.slotwatch.core.spi.MonitoringRepository;
import net.slotwatch.core.spi.SessionProvider;
import net.slotwatch.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 모니터링 하나의 조회 → 평가 → 예약 루프.
 * 취소는 사이클 사이에서만 반영되며, 예약 에피소드 도중에는 끊지 않는다.
 */
public final class MonitoringWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(MonitoringWorker.class);

    private final long monitoringId;
    private final MonitoringRepository monitorings;
    private final TxRunner tx;
    private final SessionProvider sessions;
    private final CoefficientQuery query;
    private final CandidateEvaluator evaluator;
    private final BookingOrchestrator orchestrator;
    private final Notifier notifier;
    private final Clock clock;
    private final WorkerSettings settings;
    private final RetirementGuard retirement;

    private final WorkerState state = new WorkerState();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);
    private final AtomicLong cycles = new AtomicLong();
    private volatile boolean cancelled;

    // 직전 사이클에서 본 조건과 제외 날짜. 편집 감지용
    private MonitoringConstraints seenConstraints;
    private Set<LocalDate> seenFailedDates = Set.of();

    MonitoringWorker(long monitoringId,
                     MonitoringRepository monitorings,
                     TxRunner tx,
                     SessionProvider sessions,
                     CoefficientQuery query,
                     CandidateEvaluator evaluator,
                     BookingOrchestrator orchestrator,
                     Notifier notifier,
                     Clock clock,
                     WorkerSettings settings,
                     RetirementGuard retirement) {
        this.monitoringId = monitoringId;
        this.monitorings = monitorings;
        this.tx = tx;
        this.sessions = sessions;
        this.query = query;
        this.evaluator = evaluator;
        this.orchestrator = orchestrator;
        this.notifier = notifier;
        this.clock = clock;
        this.settings = settings;
        this.retirement = retirement;
    }

    @Override
    public void run() {
        log.info("Worker started for monitoring {}", monitoringId);
        try {
            while (!cancelled) {
                Duration pause;
                try {
                    pause = cycle();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("Monitoring {}: cycle failed, retrying in {}", monitoringId, settings.errorPause(), e);
                    pause = settings.errorPause();
                } finally {
                    cycles.incrementAndGet();
                }
                if (pause == null || cancelled) break;
                if (!sleep(pause)) break;
            }
        } finally {
            state.clear();
            log.info("Worker stopped for monitoring {} after {} cycles", monitoringId, cycles.get());
        }
    }

    /** @return 다음 사이클까지 쉴 시간. null이면 루프 종료 */
    Duration cycle() throws Exception {
        Optional<Monitoring> current = tx.required(() -> monitorings.findById(monitoringId));
        if (current.isEmpty() || !current.get().active()) {
            log.info("Monitoring {} is no longer active, worker exits", monitoringId);
            return null;
        }
        Monitoring m = current.get();
        if (edited(m)) {
            log.info("Monitoring {} was edited, best-slot records reset", monitoringId);
            state.clear();
        }
        seenConstraints = m.constraints();
        seenFailedDates = m.failedDates();

        try {
            List<SlotOffer> offers;
            try {
                String credential = sessions.credential(m.ownerId());
                offers = query.query(credential, m.warehouseIds());
            } catch (UpstreamRateLimitedException e) {
                Duration pause = longer(settings.rateLimitPause(), e.getRetryAfter());
                log.warn("Monitoring {}: upstream rate limit hit, pausing {}", monitoringId, pause);
                return pause;
            } catch (UpstreamAuthException e) {
                throw e;
            } catch (UpstreamException e) {
                log.warn("Monitoring {}: coefficient query failed: {}", monitoringId, e.getMessage());
                return pollInterval(m);
            }

            Evaluation evaluation = evaluator.evaluate(m, offers, state.bestSnapshot());
            tx.required(() -> { monitorings.touchLastCheck(monitoringId, clock.now()); return null; });
            log.debug("Monitoring {}: {} offers, {} accepted, {} improved",
                    monitoringId, offers.size(), evaluation.accepted().size(), evaluation.improvements().size());

            List<CandidateSlot> improved = evaluation.improvements();
            if (!improved.isEmpty()) {
                improved.forEach(state::recordBest);

                // 에피소드는 순위가 가장 높은 후보 하나만. 실패하면 다음 사이클에서 재평가
                CandidateSlot best = improved.get(0);
                log.info("Monitoring {}: new best slot at warehouse {} on {} (coefficient {})",
                        monitoringId, best.warehouseId(), best.date(), best.coefficient());
                notifier.found(m, best);

                EpisodeOutcome outcome = orchestrator.runEpisode(m, best, state, retirement);
                if (outcome == EpisodeOutcome.SUCCEEDED) {
                    cancel();
                    return null;
                }
            }
            return pollInterval(m);
        } catch (UpstreamAuthException e) {
            authRequired(m, e);
            return null;
        }
    }

    /** 조건이 바뀌었거나 제외 날짜가 비워졌으면 편집된 것으로 본다 */
    private boolean edited(Monitoring m) {
        if (seenConstraints == null) return false;
        return !seenConstraints.equals(m.constraints()) || !m.failedDates().containsAll(seenFailedDates);
    }

    private void authRequired(Monitoring m, UpstreamAuthException e) throws Exception {
        log.warn("Monitoring {} paused, authorization required: {}", monitoringId, e.getMessage());
        state.clear();
        tx.required(() -> monitorings.updateStatus(monitoringId, MonitoringStatus.PAUSED, clock.now()));
        notifier.authRequired(m, e.getMessage());
    }

    private Duration pollInterval(Monitoring m) {
        return m.pollInterval() != null ? m.pollInterval() : settings.pollInterval();
    }

    private static Duration longer(Duration a, Duration b) {
        return b != null && b.compareTo(a) > 0 ? b : a;
    }

    /** @return 취소/인터럽트 없이 다 잤으면 true */
    private boolean sleep(Duration pause) {
        try {
            return !cancelSignal.await(pause.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void cancel() {
        cancelled = true;
        cancelSignal.countDown();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public long monitoringId() {
        return monitoringId;
    }

    public long completedCycles() {
        return cycles.get();
    }

    public WorkerState state() {
        return state;
    }
}
