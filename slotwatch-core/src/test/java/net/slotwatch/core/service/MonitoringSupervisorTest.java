package net.slotwatch.core.service;

import net.slotwatch.core.fake.DirectTxRunner;
import net.slotwatch.core.fake.InMemoryMonitoringRepository;
import net.slotwatch.core.fake.InMemoryOwnerCredentialRepository;
import net.slotwatch.core.fake.RecordingNotificationSink;
import net.slotwatch.core.fake.ScriptedBookingAction;
import net.slotwatch.core.fake.ScriptedCoefficientQuery;
import net.slotwatch.core.model.BookingResult;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.MonitoringStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static net.slotwatch.core.fake.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class MonitoringSupervisorTest {

    private InMemoryMonitoringRepository monitorings;
    private ScriptedCoefficientQuery query;
    private ScriptedBookingAction booking;
    private RecordingNotificationSink sink;
    private ExecutorService pool;
    private MonitoringSupervisor supervisor;
    private final AtomicReference<Instant> now = new AtomicReference<>(NOW);

    @BeforeEach
    void setUp() throws Exception {
        monitorings = new InMemoryMonitoringRepository();
        InMemoryOwnerCredentialRepository credentials = new InMemoryOwnerCredentialRepository();
        credentials.save(credential(OWNER));
        query = new ScriptedCoefficientQuery();
        booking = new ScriptedBookingAction();
        sink = new RecordingNotificationSink();

        DirectTxRunner tx = new DirectTxRunner();
        StoredSessionProvider sessions = new StoredSessionProvider(credentials, tx, now::get);
        Notifier notifier = new Notifier(sink);
        BookingOrchestrator orchestrator = new BookingOrchestrator(booking, sessions, new OwnerSessionLeases(),
                monitorings, tx, notifier, now::get, RetryPolicy.fixed(Duration.ZERO), 3);
        WorkerFactory workers = new WorkerFactory(monitorings, tx, sessions, query,
                new CandidateEvaluator(ZoneOffset.UTC), orchestrator, notifier, now::get,
                new WorkerSettings(Duration.ofMillis(50), Duration.ofMillis(50), Duration.ofMillis(50)));

        pool = Executors.newCachedThreadPool();
        supervisor = new MonitoringSupervisor(monitorings, tx, workers, pool, now::get,
                Duration.ofSeconds(60), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private Monitoring activeMonitoring() throws Exception {
        return monitorings.create(Monitoring.create(OWNER, scenarioConstraints(), NOW));
    }

    @Test
    void tickDoesNothingBeforeStart() throws Exception {
        activeMonitoring();
        supervisor.tick();
        assertThat(supervisor.runningIds()).isEmpty();
        assertThat(query.calls()).isZero();
    }

    @Test
    void reconcileSpawnsOneWorkerPerActiveMonitoring() throws Exception {
        Monitoring a = activeMonitoring();
        Monitoring b = activeMonitoring();
        Monitoring paused = activeMonitoring();
        monitorings.updateStatus(paused.id(), MonitoringStatus.PAUSED, NOW);

        ReconcileReport first = supervisor.reconcile();
        ReconcileReport second = supervisor.reconcile();

        assertThat(first.started()).isEqualTo(2);
        assertThat(second.started()).isZero();
        assertThat(supervisor.runningIds()).containsExactlyInAnyOrder(a.id(), b.id());
    }

    @Test
    void workerThreadIsNamedAfterMonitoring() throws Exception {
        Monitoring m = activeMonitoring();
        query.respondWith(List.of());

        supervisor.reconcile();
        await().atMost(Duration.ofSeconds(5)).until(() -> query.calls() > 0);

        assertThat(query.lastThreadName()).isEqualTo(MonitoringSupervisor.WORKER_THREAD_PREFIX + m.id());
    }

    @Test
    void workerOfDeactivatedMonitoringIsCancelledAndRemoved() throws Exception {
        Monitoring m = activeMonitoring();
        supervisor.reconcile();
        assertThat(supervisor.isRunning(m.id())).isTrue();

        monitorings.updateStatus(m.id(), MonitoringStatus.PAUSED, NOW);
        ReconcileReport r = supervisor.reconcile();

        assertThat(r.cancelled()).isEqualTo(1);
        await().atMost(Duration.ofSeconds(5)).until(() -> !supervisor.isRunning(m.id()));
    }

    @Test
    void successfulBookingRetiresMonitoring_andItIsNeverRespawned() throws Exception {
        Monitoring m = activeMonitoring();
        query.respondWith(List.of(offer(5, "2025-09-12", 1)));
        booking.then(BookingResult.succeeded("ok"));
        supervisor.start();

        supervisor.tick();
        await().atMost(Duration.ofSeconds(5)).until(() -> !supervisor.isRunning(m.id()));

        assertThat(monitorings.findById(m.id())).isEmpty();
        ReconcileReport r = supervisor.reconcile();
        assertThat(r.started()).isZero();
        assertThat(supervisor.isRunning(m.id())).isFalse();
        assertThat(booking.calls()).hasSize(1);
        assertThat(supervisor.isRetiring(m.id())).isFalse();
    }

    @Test
    void retiringIdIsSkippedWhileStillActive() throws Exception {
        Monitoring m = activeMonitoring();
        supervisor.markRetiring(m.id());

        ReconcileReport r = supervisor.reconcile();

        assertThat(r.skippedRetiring()).isEqualTo(1);
        assertThat(supervisor.isRunning(m.id())).isFalse();

        monitorings.updateStatus(m.id(), MonitoringStatus.STOPPED, NOW);
        supervisor.reconcile();
        assertThat(supervisor.isRetiring(m.id())).isFalse();
    }

    @Test
    void failedReconcileBacksOff_andKeepsExistingWorkers() throws Exception {
        Monitoring m = activeMonitoring();
        query.respondWith(List.of());
        supervisor.start();
        supervisor.tick();
        assertThat(supervisor.isRunning(m.id())).isTrue();

        monitorings.setUnavailable(true);
        supervisor.tick();
        assertThat(supervisor.isRunning(m.id())).isTrue();

        // 백오프 중에는 DB가 돌아와도 시도하지 않는다
        monitorings.setUnavailable(false);
        Monitoring other = activeMonitoring();
        now.set(NOW.plusSeconds(30));
        supervisor.tick();
        assertThat(supervisor.isRunning(other.id())).isFalse();

        now.set(NOW.plusSeconds(61));
        supervisor.tick();
        assertThat(supervisor.isRunning(other.id())).isTrue();
    }

    @Test
    void shutdownStopsAllWorkers() throws Exception {
        activeMonitoring();
        activeMonitoring();
        query.respondWith(List.of());
        supervisor.reconcile();

        supervisor.shutdown();

        assertThat(pool.isTerminated()).isTrue();
        assertThat(supervisor.runningIds()).isEmpty();
        assertThat(supervisor.isStarted()).isFalse();
    }
}
