package net.slotwatch.adapter.jdbc.repo;

import net.slotwatch.adapter.jdbc.JdbcUtil;
import net.slotwatch.adapter.jdbc.TxContext;
import net.slotwatch.adapter.jdbc.mapper.RowMappers;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.MonitoringConstraints;
import net.slotwatch.core.model.MonitoringStatus;
import net.slotwatch.core.spi.MonitoringRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public final class JdbcMonitoringRepository implements MonitoringRepository {

    @Override
    public Monitoring create(Monitoring m) throws Exception {
        Connection c = TxContext.require();
        long id;
        try (var ps = c.prepareStatement("""
            INSERT INTO TB_MONITORING
                (OWNER_ID, COEFFICIENT_MIN, COEFFICIENT_MAX, BOX_TYPE_ID, LOGISTICS_SHOULDER_DAYS,
                 DATE_FROM, DATE_TO, ORDER_REF, STATUS, POLL_INTERVAL_MS, LAST_CHECK_AT, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, m.ownerId());
            ps.setDouble(2, m.coefficientMin());
            ps.setDouble(3, m.coefficientMax());
            JdbcUtil.setNullableInt(ps, 4, m.boxTypeId());
            ps.setInt(5, m.logisticsShoulderDays());
            ps.setDate(6, JdbcUtil.date(m.dateFrom()));
            ps.setDate(7, JdbcUtil.date(m.dateTo()));
            ps.setString(8, m.orderRef());
            ps.setString(9, m.status().name());
            JdbcUtil.setNullableMillis(ps, 10, m.pollInterval());
            ps.setTimestamp(11, JdbcUtil.ts(m.lastCheckAt()));
            ps.setTimestamp(12, JdbcUtil.ts(m.createdAt()));
            ps.setTimestamp(13, JdbcUtil.ts(m.updatedAt() == null ? m.createdAt() : m.updatedAt()));
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("no generated key for TB_MONITORING");
                id = keys.getLong(1);
            }
        }
        insertWarehouses(c, id, m.warehouseIds());
        for (LocalDate d : m.failedDates()) addFailedDate(id, d, m.createdAt());
        return findById(id).orElseThrow();
    }

    @Override
    public Optional<Monitoring> findById(long id) throws Exception {
        try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_MONITORING WHERE ID = ?")) {
            ps.setLong(1, id);
            List<Monitoring> rows = list(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    @Override
    public List<Monitoring> findAllActive() throws Exception {
        try (var ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_MONITORING WHERE STATUS = 'ACTIVE' ORDER BY ID")) {
            return list(ps);
        }
    }

    @Override
    public List<Monitoring> findByOwner(long ownerId) throws Exception {
        try (var ps = TxContext.require().prepareStatement(
                "SELECT * FROM TB_MONITORING WHERE OWNER_ID = ? ORDER BY ID")) {
            ps.setLong(1, ownerId);
            return list(ps);
        }
    }

    /** 조건 교체. 제외 날짜도 함께 비운다. */
    @Override
    public boolean updateConstraints(long id, MonitoringConstraints k, Instant now) throws Exception {
        Connection c = TxContext.require();
        try (var ps = c.prepareStatement("""
            UPDATE TB_MONITORING
               SET COEFFICIENT_MIN         = ?,
                   COEFFICIENT_MAX         = ?,
                   BOX_TYPE_ID             = ?,
                   LOGISTICS_SHOULDER_DAYS = ?,
                   DATE_FROM               = ?,
                   DATE_TO                 = ?,
                   ORDER_REF               = ?,
                   POLL_INTERVAL_MS        = ?,
                   UPDATED_AT              = ?
             WHERE ID = ?
        """)) {
            ps.setDouble(1, k.coefficientMin());
            ps.setDouble(2, k.coefficientMax());
            JdbcUtil.setNullableInt(ps, 3, k.boxTypeId());
            ps.setInt(4, k.logisticsShoulderDays());
            ps.setDate(5, JdbcUtil.date(k.dateFrom()));
            ps.setDate(6, JdbcUtil.date(k.dateTo()));
            ps.setString(7, k.orderRef());
            JdbcUtil.setNullableMillis(ps, 8, k.pollInterval());
            ps.setTimestamp(9, JdbcUtil.ts(now));
            ps.setLong(10, id);
            if (ps.executeUpdate() == 0) return false;
        }
        deleteChildren(c, "TB_MONITORING_WAREHOUSE", id);
        insertWarehouses(c, id, k.warehouseIds());
        deleteChildren(c, "TB_MONITORING_FAILED_DATE", id);
        return true;
    }

    @Override
    public boolean updateStatus(long id, MonitoringStatus status, Instant now) throws Exception {
        try (var ps = TxContext.require().prepareStatement(
                "UPDATE TB_MONITORING SET STATUS = ?, UPDATED_AT = ? WHERE ID = ?")) {
            ps.setString(1, status.name());
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            return ps.executeUpdate() > 0;
        }
    }

    /** 멱등 추가. 이미 있거나 모니터링이 없으면 false */
    @Override
    public boolean addFailedDate(long id, LocalDate date, Instant now) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
            INSERT INTO TB_MONITORING_FAILED_DATE (MONITORING_ID, FAILED_DATE, CREATED_AT)
            SELECT m.ID, CAST(? AS DATE), CAST(? AS TIMESTAMP WITH TIME ZONE)
              FROM TB_MONITORING m
             WHERE m.ID = ?
               AND NOT EXISTS (SELECT 1
                                 FROM TB_MONITORING_FAILED_DATE f
                                WHERE f.MONITORING_ID = m.ID
                                  AND f.FAILED_DATE = CAST(? AS DATE))
        """)) {
            ps.setDate(1, JdbcUtil.date(date));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setLong(3, id);
            ps.setDate(4, JdbcUtil.date(date));
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            // 동시 추가 경합에서 진 쪽
            if (JdbcUtil.isConstraintViolation(e)) return false;
            throw e;
        }
    }

    @Override
    public void touchLastCheck(long id, Instant at) throws Exception {
        try (var ps = TxContext.require().prepareStatement(
                "UPDATE TB_MONITORING SET LAST_CHECK_AT = ? WHERE ID = ?")) {
            ps.setTimestamp(1, JdbcUtil.ts(at));
            ps.setLong(2, id);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        Connection c = TxContext.require();
        deleteChildren(c, "TB_MONITORING_WAREHOUSE", id);
        deleteChildren(c, "TB_MONITORING_FAILED_DATE", id);
        try (var ps = c.prepareStatement("DELETE FROM TB_MONITORING WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    /** 호출자의 트랜잭션 안에서 STOPPED 전환과 삭제를 함께 수행 */
    @Override
    public boolean stopAndDelete(long id, Instant now) throws Exception {
        if (!updateStatus(id, MonitoringStatus.STOPPED, now)) return false;
        return delete(id);
    }

    @Override
    public List<Monitoring> stopAllActive(Instant now) throws Exception {
        List<Monitoring> active = findAllActive();
        List<Monitoring> stopped = new ArrayList<>();
        try (var ps = TxContext.require().prepareStatement("""
            UPDATE TB_MONITORING
               SET STATUS = 'STOPPED', UPDATED_AT = ?
             WHERE ID = ? AND STATUS = 'ACTIVE'
        """)) {
            for (Monitoring m : active) {
                ps.setTimestamp(1, JdbcUtil.ts(now));
                ps.setLong(2, m.id());
                if (ps.executeUpdate() > 0) stopped.add(m);
            }
        }
        return stopped;
    }

    // === utils ===

    private List<Monitoring> list(PreparedStatement ps) throws SQLException {
        Connection c = ps.getConnection();
        List<Monitoring> out = new ArrayList<>();
        try (var rs = ps.executeQuery()) {
            while (rs.next()) {
                long id = rs.getLong("ID");
                out.add(RowMappers.toMonitoring(rs, warehouses(c, id), failedDates(c, id)));
            }
        }
        return out;
    }

    private static Set<Long> warehouses(Connection c, long id) throws SQLException {
        try (var ps = c.prepareStatement(
                "SELECT WAREHOUSE_ID FROM TB_MONITORING_WAREHOUSE WHERE MONITORING_ID = ?")) {
            ps.setLong(1, id);
            Set<Long> out = new HashSet<>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getLong(1));
            }
            return out;
        }
    }

    private static Set<LocalDate> failedDates(Connection c, long id) throws SQLException {
        try (var ps = c.prepareStatement(
                "SELECT FAILED_DATE FROM TB_MONITORING_FAILED_DATE WHERE MONITORING_ID = ?")) {
            ps.setLong(1, id);
            Set<LocalDate> out = new HashSet<>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getDate(1).toLocalDate());
            }
            return out;
        }
    }

    private static void insertWarehouses(Connection c, long id, Set<Long> warehouseIds) throws SQLException {
        try (var ps = c.prepareStatement(
                "INSERT INTO TB_MONITORING_WAREHOUSE (MONITORING_ID, WAREHOUSE_ID) VALUES (?, ?)")) {
            for (Long wh : warehouseIds) {
                ps.setLong(1, id);
                ps.setLong(2, wh);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static void deleteChildren(Connection c, String table, long id) throws SQLException {
        // table은 내부 상수만 전달
        try (var ps = c.prepareStatement("DELETE FROM " + table + " WHERE MONITORING_ID = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }
}
