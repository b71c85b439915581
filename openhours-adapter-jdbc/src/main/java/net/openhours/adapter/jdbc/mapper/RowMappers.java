package net.openhours.adapter.jdbc.mapper;

import net.openhours.adapter.jdbc.JdbcUtil;
import net.openhours.core.bits.DayBits;
import net.openhours.core.model.BlackoutDate;
import net.openhours.core.model.DayAvailability;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- TB_AVAILABILITY_DAY ---
    public static DayAvailability toDayAvailability(ResultSet rs) throws SQLException {
        return new DayAvailability(
                rs.getString("INSTRUCTOR_ID"),
                JdbcUtil.toLocalDate(rs.getTimestamp("DAY_DATE")),
                DayBits.fromBytes(rs.getBytes("BITS")),
                JdbcUtil.toInstant(rs.getTimestamp("UPDATED_AT"))
        );
    }

    // --- TB_BLACKOUT_DATE ---
    public static BlackoutDate toBlackoutDate(ResultSet rs) throws SQLException {
        return new BlackoutDate(
                rs.getString("ID"),
                rs.getString("INSTRUCTOR_ID"),
                JdbcUtil.toLocalDate(rs.getTimestamp("DAY_DATE")),
                rs.getString("REASON"),
                rs.getTimestamp("CREATED_AT").toInstant()
        );
    }
}
