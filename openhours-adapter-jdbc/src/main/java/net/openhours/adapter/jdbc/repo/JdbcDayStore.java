package net.openhours.adapter.jdbc.repo;

import net.openhours.adapter.jdbc.JdbcUtil;
import net.openhours.adapter.jdbc.TxContext;
import net.openhours.adapter.jdbc.mapper.RowMappers;
import net.openhours.core.bits.DayBits;
import net.openhours.core.model.DayAvailability;
import net.openhours.core.model.WeekBits;
import net.openhours.core.spi.DayStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** TB_AVAILABILITY_DAY: (INSTRUCTOR_ID, DAY_DATE) → BITS RAW(6) */
public final class JdbcDayStore implements DayStore {

    @Override
    public Optional<DayAvailability> getDay(String instructorId, LocalDate date) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT INSTRUCTOR_ID, DAY_DATE, BITS, UPDATED_AT
                FROM   TB_AVAILABILITY_DAY
                WHERE  INSTRUCTOR_ID = ?
                  AND  DAY_DATE = ?
            """)) {
            ps.setString(1, instructorId);
            ps.setDate(2, JdbcUtil.date(date));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toDayAvailability(rs));
            }
        }
    }

    @Override
    public WeekBits getWeek(String instructorId, LocalDate weekStart) throws Exception {
        Connection c = TxContext.require();
        Map<LocalDate, DayBits> byDate = new HashMap<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT INSTRUCTOR_ID, DAY_DATE, BITS, UPDATED_AT
                FROM   TB_AVAILABILITY_DAY
                WHERE  INSTRUCTOR_ID = ?
                  AND  DAY_DATE BETWEEN ? AND ?
            """)) {
            ps.setString(1, instructorId);
            ps.setDate(2, JdbcUtil.date(weekStart));
            ps.setDate(3, JdbcUtil.date(weekStart.plusDays(WeekBits.DAYS - 1)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    DayAvailability row = RowMappers.toDayAvailability(rs);
                    byDate.put(row.date(), row.bits());
                }
            }
        }
        return WeekBits.of(weekStart, byDate);
    }

    @Override
    public int upsertWeek(String instructorId, LocalDate weekStart, Map<LocalDate, DayBits> days) throws Exception {
        if (days.isEmpty()) return 0;
        Connection c = TxContext.require();
        // Oracle MERGE, 하루 1행. 배치 하나로 묶어 같은 트랜잭션에서 실행
        try (PreparedStatement ps = c.prepareStatement("""
                MERGE INTO TB_AVAILABILITY_DAY d
                USING (SELECT ? INSTRUCTOR_ID, ? DAY_DATE, ? BITS FROM dual) s
                   ON (d.INSTRUCTOR_ID = s.INSTRUCTOR_ID AND d.DAY_DATE = s.DAY_DATE)
                WHEN MATCHED THEN UPDATE SET
                     d.BITS       = s.BITS,
                     d.UPDATED_AT = SYSTIMESTAMP
                WHEN NOT MATCHED THEN INSERT
                     (INSTRUCTOR_ID, DAY_DATE, BITS, UPDATED_AT)
                VALUES (s.INSTRUCTOR_ID, s.DAY_DATE, s.BITS, SYSTIMESTAMP)
            """)) {
            for (Map.Entry<LocalDate, DayBits> e : days.entrySet()) {
                if (!WeekBits.mondayOf(e.getKey()).equals(weekStart)) {
                    throw new IllegalArgumentException(e.getKey() + " is outside week " + weekStart);
                }
                ps.setString(1, instructorId);
                ps.setDate(2, JdbcUtil.date(e.getKey()));
                ps.setBytes(3, e.getValue().toBytes());
                ps.addBatch();
            }
            int rows = 0;
            for (int n : ps.executeBatch()) {
                rows += (n == Statement.SUCCESS_NO_INFO) ? 1 : n;
            }
            return rows;
        }
    }

    @Override
    public boolean clear(String instructorId, LocalDate date) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM TB_AVAILABILITY_DAY WHERE INSTRUCTOR_ID = ? AND DAY_DATE = ?")) {
            ps.setString(1, instructorId);
            ps.setDate(2, JdbcUtil.date(date));
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public int clearWeek(String instructorId, LocalDate weekStart) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                DELETE FROM TB_AVAILABILITY_DAY
                 WHERE INSTRUCTOR_ID = ?
                   AND DAY_DATE BETWEEN ? AND ?
            """)) {
            ps.setString(1, instructorId);
            ps.setDate(2, JdbcUtil.date(weekStart));
            ps.setDate(3, JdbcUtil.date(weekStart.plusDays(WeekBits.DAYS - 1)));
            return ps.executeUpdate();
        }
    }

    @Override
    public long countOlderThan(LocalDate cutoff) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COUNT(*) FROM TB_AVAILABILITY_DAY WHERE DAY_DATE < ?")) {
            ps.setDate(1, JdbcUtil.date(cutoff));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    @Override
    public int deleteOlderThan(LocalDate cutoff) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM TB_AVAILABILITY_DAY WHERE DAY_DATE < ?")) {
            ps.setDate(1, JdbcUtil.date(cutoff));
            return ps.executeUpdate();
        }
    }
}
