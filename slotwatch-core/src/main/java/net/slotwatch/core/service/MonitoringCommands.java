package net.slotwatch.core.service;

import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.MonitoringConstraints;
import net.slotwatch.core.model.MonitoringStatus;
import net.slotwatch.core.spi.Clock;
import net.slotwatch.core.spi.MonitoringRepository;
import net.slotwatch.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/** 호스트 애플리케이션(봇 등)이 쓰는 모니터링 관리 명령 */
public final class MonitoringCommands {
    private static final Logger log = LoggerFactory.getLogger(MonitoringCommands.class);

    private final MonitoringRepository monitorings;
    private final TxRunner tx;
    private final Clock clock;

    public MonitoringCommands(MonitoringRepository monitorings, TxRunner tx, Clock clock) {
        this.monitorings = monitorings;
        this.tx = tx;
        this.clock = clock;
    }

    public Monitoring create(long ownerId, MonitoringConstraints constraints) throws Exception {
        Monitoring created = tx.required(() -> monitorings.create(Monitoring.create(ownerId, constraints, clock.now())));
        log.info("Monitoring {} created for owner {} (warehouses={})", created.id(), ownerId, constraints.warehouseIds());
        return created;
    }

    /** 조건을 바꾸면 제외 날짜 목록도 비워진다. */
    public boolean edit(long id, MonitoringConstraints constraints) throws Exception {
        return tx.required(() -> monitorings.updateConstraints(id, constraints, clock.now()));
    }

    public boolean pause(long id) throws Exception {
        return transition(id, MonitoringStatus.ACTIVE, MonitoringStatus.PAUSED);
    }

    public boolean resume(long id) throws Exception {
        return transition(id, MonitoringStatus.PAUSED, MonitoringStatus.ACTIVE);
    }

    public boolean delete(long id) throws Exception {
        return tx.required(() -> monitorings.delete(id));
    }

    public Optional<Monitoring> find(long id) throws Exception {
        return tx.required(() -> monitorings.findById(id));
    }

    public List<Monitoring> listByOwner(long ownerId) throws Exception {
        return tx.required(() -> monitorings.findByOwner(ownerId));
    }

    private boolean transition(long id, MonitoringStatus from, MonitoringStatus to) throws Exception {
        return tx.required(() -> {
            Optional<Monitoring> m = monitorings.findById(id);
            if (m.isEmpty() || m.get().status() != from) return false;
            return monitorings.updateStatus(id, to, clock.now());
        });
    }
}
