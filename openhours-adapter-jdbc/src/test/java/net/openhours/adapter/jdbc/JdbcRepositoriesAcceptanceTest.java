package net.openhours.adapter.jdbc;

import net.openhours.adapter.jdbc.json.AvailabilityJson;
import net.openhours.adapter.jdbc.repo.JdbcAuditRepository;
import net.openhours.adapter.jdbc.repo.JdbcBlackoutRepository;
import net.openhours.adapter.jdbc.repo.JdbcOutboxRepository;
import net.openhours.core.model.AuditRecord;
import net.openhours.core.model.BlackoutDate;
import net.openhours.core.model.OutboxEvent;
import net.openhours.core.model.Window;
import net.openhours.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JdbcRepositoriesAcceptanceTest extends TestSupport {
    static final String INST = "inst-repo";
    static final Instant T0 = Instant.parse("2025-03-05T03:00:00Z");
    static final LocalDate MON = LocalDate.of(2025, 3, 10);

    TxRunner tx;
    JdbcBlackoutRepository blackouts;
    JdbcAuditRepository audits;
    JdbcOutboxRepository outbox;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        AvailabilityJson json = new AvailabilityJson();
        blackouts = new JdbcBlackoutRepository();
        audits = new JdbcAuditRepository(json);
        outbox = new JdbcOutboxRepository(json);
    }

    @BeforeEach
    void clean() throws Exception {
        truncateAll();
    }

    @Test
    @DisplayName("블랙아웃: (강사, 날짜) 중복 insert 는 false")
    void blackout_duplicateDate_returnsFalse() throws Exception {
        assertTrue(tx.required(() -> blackouts.insert(
                BlackoutDate.ofNew("b-1", INST, MON, "holiday", T0))));
        assertFalse(tx.required(() -> blackouts.insert(
                BlackoutDate.ofNew("b-2", INST, MON, "again", T0))));

        BlackoutDate found = tx.required(() -> blackouts.find(INST, MON)).orElseThrow();
        assertEquals("b-1", found.id());
        assertEquals("holiday", found.reason());
        assertEquals(found, tx.required(() -> blackouts.findById(INST, "b-1")).orElseThrow());
    }

    @Test
    @DisplayName("블랙아웃: findFrom/findBetween 날짜 오름차순, delete 는 소유 강사만")
    void blackout_rangeQueries_andDelete() throws Exception {
        tx.required(() -> {
            blackouts.insert(BlackoutDate.ofNew("b-3", INST, MON.plusDays(9), null, T0));
            blackouts.insert(BlackoutDate.ofNew("b-1", INST, MON, null, T0));
            blackouts.insert(BlackoutDate.ofNew("b-2", INST, MON.plusDays(2), null, T0));
            blackouts.insert(BlackoutDate.ofNew("b-x", "someone-else", MON, null, T0));
            return null;
        });

        assertEquals(List.of("b-1", "b-2", "b-3"),
                tx.required(() -> blackouts.findFrom(INST, MON)).stream().map(BlackoutDate::id).toList());
        assertEquals(List.of("b-1", "b-2"),
                tx.required(() -> blackouts.findBetween(INST, MON, MON.plusDays(6)))
                        .stream().map(BlackoutDate::id).toList());

        assertFalse(tx.required(() -> blackouts.delete(INST, "b-x")));
        assertTrue(tx.required(() -> blackouts.delete(INST, "b-1")));
        assertTrue(tx.required(() -> blackouts.find(INST, MON)).isEmpty());
    }

    @Test
    @DisplayName("감사: 스냅샷 JSON 왕복, 최신순")
    void audit_appendAndFindRecent() throws Exception {
        Map<LocalDate, List<Window>> before = Map.of(MON, List.of());
        Map<LocalDate, List<Window>> after = Map.of(MON, List.of(
                Window.parse("09:00:00", "12:00:00"), Window.parse("22:00:00", "24:00:00")));
        tx.required(() -> {
            audits.append(new AuditRecord("a-1", T0, INST, "admin", AuditRecord.ACTION_WEEK_SAVED,
                    MON, List.of(MON), before, after));
            audits.append(new AuditRecord("a-2", T0.plusSeconds(60), INST, "admin",
                    AuditRecord.ACTION_BLACKOUT_ADDED, MON, List.of(MON), after, before));
            return null;
        });

        List<AuditRecord> recent = tx.required(() -> audits.findRecent(INST, 10));
        assertEquals(List.of("a-2", "a-1"), recent.stream().map(AuditRecord::auditId).toList());

        AuditRecord first = recent.get(1);
        assertEquals(MON, first.weekStart());
        assertEquals(List.of(MON), first.targetDates());
        assertEquals(after, first.after());
        assertEquals("24:00:00", first.after().get(MON).get(1).end());
        assertThat(first.before().get(MON)).isEmpty();
    }

    @Test
    @DisplayName("outbox: pending 오래된 순, markSent 후 제외")
    void outbox_pendingAndMarkSent() throws Exception {
        OutboxEvent e1 = new OutboxEvent("e-1", OutboxEvent.WEEK_SAVED, INST, MON, List.of(MON), "v1", T0);
        OutboxEvent e2 = new OutboxEvent("e-2", OutboxEvent.WEEK_SAVED, INST, MON,
                List.of(MON, MON.plusDays(1)), "v2", T0.plusSeconds(5));
        tx.required(() -> {
            outbox.enqueue(e2);
            outbox.enqueue(e1);
            return null;
        });

        assertEquals(List.of(e1, e2), tx.required(() -> outbox.findPending(10)));
        assertEquals(List.of(e1), tx.required(() -> outbox.findPending(1)));

        tx.required(() -> {
            outbox.markSent("e-1");
            return null;
        });
        assertEquals(List.of(e2), tx.required(() -> outbox.findPending(10)));
    }
}
