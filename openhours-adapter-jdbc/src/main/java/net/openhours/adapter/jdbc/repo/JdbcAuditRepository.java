package net.openhours.adapter.jdbc.repo;

import net.openhours.adapter.jdbc.JdbcUtil;
import net.openhours.adapter.jdbc.TxContext;
import net.openhours.adapter.jdbc.json.AvailabilityJson;
import net.openhours.core.model.AuditRecord;
import net.openhours.core.spi.AuditRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/** TB_AVAILABILITY_AUDIT (append-only). 스냅샷은 JSON CLOB */
public final class JdbcAuditRepository implements AuditRepository {
    private final AvailabilityJson json;

    public JdbcAuditRepository(AvailabilityJson json) {
        this.json = json;
    }

    @Override
    public void append(AuditRecord r) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_AVAILABILITY_AUDIT
                    (AUDIT_ID, OCCURRED_AT, INSTRUCTOR_ID, ACTOR_ID, ACTION, WEEK_START,
                     TARGET_DATES, BEFORE_JSON, AFTER_JSON)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            ps.setString(i++, r.auditId());
            ps.setTimestamp(i++, JdbcUtil.ts(r.occurredAt()));
            ps.setString(i++, r.instructorId());
            ps.setString(i++, r.actorId());
            ps.setString(i++, r.action());
            ps.setDate(i++, JdbcUtil.date(r.weekStart()));
            ps.setString(i++, json.writeDates(r.targetDates()));
            ps.setString(i++, json.writeSnapshot(r.before()));
            ps.setString(i++, json.writeSnapshot(r.after()));
            ps.executeUpdate();
        }
    }

    @Override
    public List<AuditRecord> findRecent(String instructorId, int limit) throws Exception {
        Connection c = TxContext.require();
        List<AuditRecord> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT *
                FROM   TB_AVAILABILITY_AUDIT
                WHERE  INSTRUCTOR_ID = ?
                ORDER BY OCCURRED_AT DESC, AUDIT_ID
                FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setString(1, instructorId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AuditRecord(
                            rs.getString("AUDIT_ID"),
                            rs.getTimestamp("OCCURRED_AT").toInstant(),
                            rs.getString("INSTRUCTOR_ID"),
                            rs.getString("ACTOR_ID"),
                            rs.getString("ACTION"),
                            JdbcUtil.toLocalDate(rs.getTimestamp("WEEK_START")),
                            json.readDates(rs.getString("TARGET_DATES")),
                            json.readSnapshot(rs.getString("BEFORE_JSON")),
                            json.readSnapshot(rs.getString("AFTER_JSON"))
                    ));
                }
            }
        }
        return out;
    }
}
