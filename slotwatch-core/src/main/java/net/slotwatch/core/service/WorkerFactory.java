package net.slotwatch.core.service;

import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.CoefficientQuery;
import net.slotwatch.core.spi.MonitoringRepository;
import net.slotwatch.core.spi.SessionProvider;
import net.slotwatch.core.spi.TxRunner;

/** 워커 간에 공유되는 협력자를 묶어 워커를 만든다. */
public final class WorkerFactory {
    private final MonitoringRepository monitorings;
    private final TxRunner tx;
    private final SessionProvider sessions;
    private final CoefficientQuery query;
    private final CandidateEvaluator evaluator;
    private final BookingOrchestrator orchestrator;
    private final Notifier notifier;
    private final Clock clock;
    private final WorkerSettings settings;

    public WorkerFactory(MonitoringRepository monitorings,
                         TxRunner tx,
                         SessionProvider sessions,
                         CoefficientQuery query,
                         CandidateEvaluator evaluator,
                         BookingOrchestrator orchestrator,
                         Notifier notifier,
                         Clock clock,
                         WorkerSettings settings) {
        this.monitorings = monitorings;
        this.tx = tx;
        this.sessions = sessions;
        this.query = query;
        this.evaluator = evaluator;
        this.orchestrator = orchestrator;
        this.notifier = notifier;
        this.clock = clock;
        this.settings = settings;
    }

    public MonitoringWorker create(long monitoringId, RetirementGuard retirement) {
        return new MonitoringWorker(monitoringId, monitorings, tx, sessions, query,
                evaluator, orchestrator, notifier, clock, settings, retirement);
    }
}
