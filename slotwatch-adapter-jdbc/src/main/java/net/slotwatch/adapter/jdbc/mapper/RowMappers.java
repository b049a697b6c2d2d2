package net.slotwatch.adapter.jdbc.mapper;

import net.slotwatch.adapter.jdbc.JdbcUtil;
import net.slotwatch.core.model.Monitoring;
import net.slotwatch.core.model.MonitoringStatus;
import net.slotwatch.core.model.OwnerCredential;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Set;

public final class RowMappers {
    private RowMappers() {}

    // --- Monitoring (창고/제외 날짜는 별도 테이블에서 읽어 넘겨받음) ---
    public static Monitoring toMonitoring(ResultSet rs, Set<Long> warehouseIds, Set<LocalDate> failedDates)
            throws SQLException {
        return new Monitoring(
                rs.getLong("ID"),
                rs.getLong("OWNER_ID"),
                rs.getDouble("COEFFICIENT_MIN"),
                rs.getDouble("COEFFICIENT_MAX"),
                warehouseIds,
                JdbcUtil.getNullableInt(rs, "BOX_TYPE_ID"),
                rs.getInt("LOGISTICS_SHOULDER_DAYS"),
                JdbcUtil.toLocalDate(rs.getDate("DATE_FROM")),
                JdbcUtil.toLocalDate(rs.getDate("DATE_TO")),
                rs.getString("ORDER_REF"),
                MonitoringStatus.from(rs.getString("STATUS")),
                failedDates,
                JdbcUtil.getNullableMillis(rs, "POLL_INTERVAL_MS"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_CHECK_AT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- OwnerCredential ---
    public static OwnerCredential toOwnerCredential(ResultSet rs) throws SQLException {
        return new OwnerCredential(
                rs.getLong("OWNER_ID"),
                rs.getString("API_TOKEN"),
                rs.getString("SESSION_DATA"),
                JdbcUtil.toInstant(rs.getTimestamp("SESSION_EXPIRES_AT")),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }
}
