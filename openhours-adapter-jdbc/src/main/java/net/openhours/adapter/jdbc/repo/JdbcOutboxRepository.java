package net.openhours.adapter.jdbc.repo;

import net.openhours.adapter.jdbc.JdbcUtil;
import net.openhours.adapter.jdbc.TxContext;
import net.openhours.adapter.jdbc.json.AvailabilityJson;
import net.openhours.core.model.OutboxEvent;
import net.openhours.core.spi.OutboxRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * TB_OUTBOX_EVENT. 엔진은 enqueue 만 하고, 전달(findPending → markSent)은 외부 디스패처 몫.
 * AGGREGATE_ID = 강사 ID.
 */
public final class JdbcOutboxRepository implements OutboxRepository {
    private final AvailabilityJson json;

    public JdbcOutboxRepository(AvailabilityJson json) {
        this.json = json;
    }

    @Override
    public void enqueue(OutboxEvent e) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_OUTBOX_EVENT
                    (EVENT_ID, EVENT_TYPE, AGGREGATE_ID, IDEMPOTENCY_KEY, PAYLOAD, CREATED_AT)
                VALUES (?, ?, ?, ?, ?, ?)
            """)) {
            int i = 1;
            ps.setString(i++, e.eventId());
            ps.setString(i++, e.eventType());
            ps.setString(i++, e.instructorId());
            ps.setString(i++, e.idempotencyKey());
            ps.setString(i++, json.writeEventPayload(e));
            ps.setTimestamp(i++, JdbcUtil.ts(e.createdAt()));
            ps.executeUpdate();
        }
    }

    @Override
    public List<OutboxEvent> findPending(int limit) throws Exception {
        Connection c = TxContext.require();
        List<OutboxEvent> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT EVENT_ID, EVENT_TYPE, PAYLOAD, CREATED_AT
                FROM   TB_OUTBOX_EVENT
                WHERE  SENT_AT IS NULL
                ORDER BY CREATED_AT, EVENT_ID
                FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(json.readEvent(
                            rs.getString("EVENT_ID"),
                            rs.getString("EVENT_TYPE"),
                            rs.getString("PAYLOAD"),
                            rs.getTimestamp("CREATED_AT").toInstant()));
                }
            }
        }
        return out;
    }

    @Override
    public void markSent(String eventId) throws Exception {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_OUTBOX_EVENT
                   SET SENT_AT = SYSTIMESTAMP
                 WHERE EVENT_ID = ?
                   AND SENT_AT IS NULL
            """)) {
            ps.setString(1, eventId);
            ps.executeUpdate();
        }
    }
}
