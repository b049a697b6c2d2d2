package net.slotwatch.core.service;

import net.slotwatch.core.exception.UpstreamAuthException;
import net.slotwatch.core.model.BookingResult;
import net.slotwatch.core.model.CandidateSlot;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.SessionHandle;
import net.slotwatch.core.spi.BookingAction;
import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.MonitoringRepository;
import net.slotwatch.core.spi.SessionProvider;
import net.slotwatch.core.spi.TxRunner;
import net.slotwatch.core.util.MessageSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 후보 슬롯 하나에 대한 예약 에피소드.
 * 최대 maxAttempts번 시도하고 결과에 따라 모니터링 상태와 워커 캐시를 갱신한다.
 */
public final class BookingOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BookingOrchestrator.class);

    private final BookingAction booking;
    private final SessionProvider sessions;
    private final OwnerSessionLeases leases;
    private final MonitoringRepository monitorings;
    private final TxRunner tx;
    private final Notifier notifier;
    private final Clock clock;
    private final RetryPolicy retry;
    private final int maxAttempts;

    public BookingOrchestrator(BookingAction booking,
                               SessionProvider sessions,
                               OwnerSessionLeases leases,
                               MonitoringRepository monitorings,
                               TxRunner tx,
                               Notifier notifier,
                               Clock clock,
                               RetryPolicy retry,
                               int maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.booking = booking;
        this.sessions = sessions;
        this.leases = leases;
        this.monitorings = monitorings;
        this.tx = tx;
        this.notifier = notifier;
        this.clock = clock;
        this.retry = retry;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws UpstreamAuthException 세션 만료 또는 예약 시 세션 거부. 날짜는 제외되지 않고 워커가 처리한다.
     */
    public EpisodeOutcome runEpisode(Monitoring m,
                                     CandidateSlot slot,
                                     WorkerState state,
                                     RetirementGuard retirement) throws Exception {
        // 사전 조건: 시도 횟수를 소모하지 않고, 최선 기록은 유지
        if (!m.hasOrderRef()) {
            log.warn("Monitoring {}: no order reference, booking skipped", m.id());
            notifier.failed(m, slot, "order reference is missing");
            return EpisodeOutcome.PRECONDITION_FAILED;
        }
        Optional<SessionHandle> session = sessions.session(m.ownerId());
        if (session.isEmpty()) {
            log.warn("Monitoring {}: owner {} has no booking session, booking skipped", m.id(), m.ownerId());
            notifier.failed(m, slot, "no booking session, sign in to the seller cabinet");
            return EpisodeOutcome.PRECONDITION_FAILED;
        }

        try (OwnerSessionLeases.Lease ignored = leases.acquire(m.ownerId())) {
            notifier.booking(m, slot);

            BookingResult last;
            try {
                while (true) {
                    int attempt = state.nextAttempt();
                    log.info("Monitoring {}: booking attempt {}/{} for warehouse {} on {}",
                            m.id(), attempt, maxAttempts, slot.warehouseId(), slot.date());

                    last = attempt(session.get(), m, slot);
                    if (last.success()) {
                        return succeed(m, slot, state, retirement);
                    }
                    if (!last.retryable() || attempt >= maxAttempts) break;

                    notifier.retrying(m, slot, attempt + 1, maxAttempts, reason(last));
                    Thread.sleep(retry.nextBackoff(attempt).toMillis());
                }
            } catch (InterruptedException e) {
                // 종료 중 중단: 날짜는 제외하지 않고 인터럽트는 워커 루프로 넘긴다
                Thread.currentThread().interrupt();
                state.clear();
                log.warn("Monitoring {}: booking episode interrupted, date {} not excluded", m.id(), slot.date());
                return EpisodeOutcome.INTERRUPTED;
            } catch (UpstreamAuthException e) {
                // 세션 거부: 날짜는 멀쩡하므로 제외하지 않는다
                log.warn("Monitoring {}: booking session rejected: {}", m.id(), e.getMessage());
                throw e;
            }

            EpisodeOutcome outcome = last.retryable() ? EpisodeOutcome.EXHAUSTED : EpisodeOutcome.TERMINAL_FAILURE;
            fail(m, slot, state, outcome, last);
            return outcome;
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private BookingResult attempt(SessionHandle session, Monitoring m, CandidateSlot slot)
            throws InterruptedException, UpstreamAuthException {
        try {
            BookingResult r = booking.book(session, m.orderRef(), slot.date(), slot.warehouseId());
            return r == null ? BookingResult.retryable("empty booking result") : r;
        } catch (InterruptedException | UpstreamAuthException e) {
            throw e;
        } catch (Exception e) {
            // 어댑터 예외(타임아웃 등)는 재시도 가능 실패
            log.warn("Monitoring {}: booking action raised {}", m.id(), e.toString());
            return BookingResult.retryable(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private EpisodeOutcome succeed(Monitoring m, CandidateSlot slot, WorkerState state,
                                   RetirementGuard retirement) throws Exception {
        // 삭제가 커밋되기 전에 재기동 대상에서 제외
        retirement.markRetiring(m.id());
        state.clear();
        try {
            tx.required(() -> monitorings.stopAndDelete(m.id(), clock.now()));
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Monitoring {}: booked but could not be removed, it stays retired until restart", m.id(), e);
        }
        log.info("Monitoring {}: booked warehouse {} on {} for order {}",
                m.id(), slot.warehouseId(), slot.date(), m.orderRef());
        notifier.succeeded(m, slot);
        return EpisodeOutcome.SUCCEEDED;
    }

    private void fail(Monitoring m, CandidateSlot slot, WorkerState state,
                      EpisodeOutcome outcome, BookingResult last) throws Exception {
        state.clear();
        boolean added = tx.required(() -> monitorings.addFailedDate(m.id(), slot.date(), clock.now()));
        log.warn("Monitoring {}: booking {} on {} ended {} ({}), date excluded={}",
                m.id(), slot.warehouseId(), slot.date(), outcome, reason(last), added);
        notifier.excluded(m, slot, reason(last));
    }

    private static String reason(BookingResult r) {
        String msg = MessageSanitizer.sanitize(r.message(), 120);
        return msg.isEmpty() ? String.valueOf(r.kind()).toLowerCase() : msg;
    }
}
