package net.openhours.adapter.jdbc;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcUtil {
    private JdbcUtil() {}

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static Instant toInstant(Timestamp ts) { return ts == null ? null : ts.toInstant(); }

    public static Date date(LocalDate d) { return d == null ? null : Date.valueOf(d); }

    /** Oracle DATE 컬럼은 시각까지 들고 오므로 날짜만 취한다 */
    public static LocalDate toLocalDate(Timestamp ts) { return ts == null ? null : ts.toLocalDateTime().toLocalDate(); }
}
