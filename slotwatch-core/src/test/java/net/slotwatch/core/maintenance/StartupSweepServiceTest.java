package net.slotwatch.core.maintenance;

import net.slotwatch.core.fake.DirectTxRunner;
import net.slotwatch.core.fake.InMemoryMonitoringRepository;
import net.slotwatch.core.fake.RecordingNotificationSink;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.MonitoringStatus;
import net.slotwatch.core.model.Notification;
import net.slotwatch.core.service.Notifier;
import org.junit.jupiter.api.Test;

import static net.slotwatch.core.fake.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class StartupSweepServiceTest {

    @Test
    void stopsEveryActiveMonitoring_andNotifiesOwners() throws Exception {
        InMemoryMonitoringRepository monitorings = new InMemoryMonitoringRepository();
        RecordingNotificationSink sink = new RecordingNotificationSink();
        StartupSweepService sweep = new StartupSweepService(monitorings, new DirectTxRunner(), new Notifier(sink), () -> NOW);

        Monitoring a = monitorings.create(Monitoring.create(OWNER, scenarioConstraints(), NOW));
        Monitoring b = monitorings.create(Monitoring.create(OWNER + 1, scenarioConstraints(), NOW));
        Monitoring paused = monitorings.create(Monitoring.create(OWNER, scenarioConstraints(), NOW));
        monitorings.updateStatus(paused.id(), MonitoringStatus.PAUSED, NOW);

        StartupSweepService.SweepReport r = sweep.sweep();

        assertEquals(2, r.stopped);
        assertEquals(2, r.notifiedOwners);
        assertEquals(NOW, r.timestamp);
        assertEquals(MonitoringStatus.STOPPED, monitorings.findById(a.id()).orElseThrow().status());
        assertEquals(MonitoringStatus.STOPPED, monitorings.findById(b.id()).orElseThrow().status());
        assertEquals(MonitoringStatus.PAUSED, monitorings.findById(paused.id()).orElseThrow().status());
        assertTrue(monitorings.findAllActive().isEmpty());
        assertTrue(sink.delivered().stream().allMatch(n -> n.outcome() == Notification.Outcome.STOPPED_ON_RESTART));

        assertEquals(0, sweep.sweep().stopped);
    }

    @Test
    void sinkFailureDoesNotBreakSweep() throws Exception {
        InMemoryMonitoringRepository monitorings = new InMemoryMonitoringRepository();
        monitorings.create(Monitoring.create(OWNER, scenarioConstraints(), NOW));
        StartupSweepService sweep = new StartupSweepService(monitorings, new DirectTxRunner(),
                new Notifier(n -> { throw new IllegalStateException("chat is down"); }), () -> NOW);

        assertEquals(1, sweep.sweep().stopped);
    }
}
