package net.slotwatch.core.maintenance;

import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.service.Notifier;
import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.MonitoringRepository;
import net.slotwatch.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * 기동 시 한 번 실행.
 * 이전 프로세스에서 ACTIVE였던 모니터링을 모두 STOPPED로 돌리고 소유자에게 알린다.
 * 재기동 후 예약 시도를 자동으로 이어가지 않는다.
 */
public final class StartupSweepService {
    private static final Logger log = LoggerFactory.getLogger(StartupSweepService.class);

    private final MonitoringRepository monitorings;
    private final TxRunner tx;
    private final Notifier notifier;
    private final Clock clock;

    public StartupSweepService(MonitoringRepository monitorings, TxRunner tx, Notifier notifier, Clock clock) {
        this.monitorings = monitorings;
        this.tx = tx;
        this.notifier = notifier;
        this.clock = clock;
    }

    public SweepReport sweep() throws Exception {
        Instant now = clock.now();
        SweepReport r = new SweepReport();

        List<Monitoring> stopped = tx.required(() -> monitorings.stopAllActive(now));
        r.stopped = stopped.size();

        for (Monitoring m : stopped) {
            notifier.stoppedOnRestart(m);
            r.notifiedOwners++;
        }

        r.timestamp = now;
        log.info("Startup sweep done: {}", r);
        return r;
    }

    public static final class SweepReport {
        public Instant timestamp;
        public int stopped;
        public int notifiedOwners;

        @Override public String toString() {
            return "SweepReport{" +
                    "timestamp=" + timestamp +
                    ", stopped=" + stopped +
                    ", notifiedOwners=" + notifiedOwners +
                    '}';
        }
    }
}
