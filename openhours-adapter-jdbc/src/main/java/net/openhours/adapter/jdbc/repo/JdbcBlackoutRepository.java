package net.openhours.adapter.jdbc.repo;

import net.openhours.adapter.jdbc.JdbcUtil;
import net.openhours.adapter.jdbc.TxContext;
import net.openhours.adapter.jdbc.mapper.RowMappers;
import net.openhours.core.model.BlackoutDate;
import net.openhours.core.spi.BlackoutRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcBlackoutRepository implements BlackoutRepository {

    @Override
    public Optional<BlackoutDate> find(String instructorId, LocalDate date) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT * FROM TB_BLACKOUT_DATE
                WHERE INSTRUCTOR_ID = ? AND DAY_DATE = ?
            """)) {
            ps.setString(1, instructorId);
            ps.setDate(2, JdbcUtil.date(date));
            return first(ps);
        }
    }

    @Override
    public Optional<BlackoutDate> findById(String instructorId, String blackoutId) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT * FROM TB_BLACKOUT_DATE
                WHERE INSTRUCTOR_ID = ? AND ID = ?
            """)) {
            ps.setString(1, instructorId);
            ps.setString(2, blackoutId);
            return first(ps);
        }
    }

    @Override
    public List<BlackoutDate> findFrom(String instructorId, LocalDate from) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT * FROM TB_BLACKOUT_DATE
                WHERE INSTRUCTOR_ID = ? AND DAY_DATE >= ?
                ORDER BY DAY_DATE
            """)) {
            ps.setString(1, instructorId);
            ps.setDate(2, JdbcUtil.date(from));
            return all(ps);
        }
    }

    @Override
    public List<BlackoutDate> findBetween(String instructorId, LocalDate from, LocalDate to) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT * FROM TB_BLACKOUT_DATE
                WHERE INSTRUCTOR_ID = ? AND DAY_DATE BETWEEN ? AND ?
                ORDER BY DAY_DATE
            """)) {
            ps.setString(1, instructorId);
            ps.setDate(2, JdbcUtil.date(from));
            ps.setDate(3, JdbcUtil.date(to));
            return all(ps);
        }
    }

    @Override
    public boolean insert(BlackoutDate b) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_BLACKOUT_DATE (ID, INSTRUCTOR_ID, DAY_DATE, REASON, CREATED_AT)
                VALUES (?, ?, ?, ?, ?)
            """)) {
            ps.setString(1, b.id());
            ps.setString(2, b.instructorId());
            ps.setDate(3, JdbcUtil.date(b.date()));
            ps.setString(4, b.reason());
            ps.setTimestamp(5, JdbcUtil.ts(b.createdAt()));
            return ps.executeUpdate() == 1;
        } catch (SQLIntegrityConstraintViolationException dup) {
            // UK (INSTRUCTOR_ID, DAY_DATE) 위반 = 이미 있음
            return false;
        }
    }

    @Override
    public boolean delete(String instructorId, String blackoutId) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM TB_BLACKOUT_DATE WHERE INSTRUCTOR_ID = ? AND ID = ?")) {
            ps.setString(1, instructorId);
            ps.setString(2, blackoutId);
            return ps.executeUpdate() > 0;
        }
    }

    private static Optional<BlackoutDate> first(PreparedStatement ps) throws Exception {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toBlackoutDate(rs));
        }
    }

    private static List<BlackoutDate> all(PreparedStatement ps) throws Exception {
        List<BlackoutDate> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toBlackoutDate(rs));
        }
        return out;
    }
}
