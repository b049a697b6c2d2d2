package net.slotwatch.core.spi;

import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.MonitoringConstraints;
import net.slotwatch.core.model.MonitoringStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/** 모든 메서드는 트랜잭션 컨텍스트 안에서 호출되어야 한다. */
public interface MonitoringRepository {
    Monitoring create(Monitoring m) throws Exception;

    Optional<Monitoring> findById(long id) throws Exception;

    List<Monitoring> findAllActive() throws Exception;

    List<Monitoring> findByOwner(long ownerId) throws Exception;

    /** 조건 교체 + failedDates 초기화 */
    boolean updateConstraints(long id, MonitoringConstraints c, Instant now) throws Exception;

    boolean updateStatus(long id, MonitoringStatus status, Instant now) throws Exception;

    /** 멱등. 새로 추가되었으면 true */
    boolean addFailedDate(long id, LocalDate date, Instant now) throws Exception;

    void touchLastCheck(long id, Instant at) throws Exception;

    boolean delete(long id) throws Exception;

    /** STOPPED 전환 후 삭제 (한 트랜잭션) */
    boolean stopAndDelete(long id, Instant now) throws Exception;

    /** ACTIVE 전부 STOPPED로. 전환된 목록(전환 전 상태) 반환 */
    List<Monitoring> stopAllActive(Instant now) throws Exception;
}
