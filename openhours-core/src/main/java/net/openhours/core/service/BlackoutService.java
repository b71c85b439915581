package net.openhours.core.service;

import net.openhours.core.bits.BitCodec;
import net.openhours.core.bits.DayBits;
import net.openhours.core.error.BlackoutConflictException;
import net.openhours.core.error.OverlapConflictException;
import net.openhours.core.model.AuditRecord;
import net.openhours.core.model.BlackoutDate;
import net.openhours.core.model.WeekBits;
import net.openhours.core.model.Window;
import net.openhours.core.spi.BlackoutRepository;
import net.openhours.core.spi.Clock;
import net.openhours.core.spi.DayStore;
import net.openhours.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 블랙아웃(휴가) 날짜 관리.
 * 블랙아웃 날짜에는 어떤 윈도우도 저장할 수 없고, 부킹 승인 검사는 BLACKOUT 으로 거절한다.
 */
public final class BlackoutService {
    private static final Logger log = LoggerFactory.getLogger(BlackoutService.class);

    private final AvailabilityEngine engine;
    private final DayStore store;
    private final BlackoutRepository blackouts;
    private final TxRunner tx;
    private final Clock clock;

    public BlackoutService(AvailabilityEngine engine, DayStore store, BlackoutRepository blackouts,
                           TxRunner tx, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.blackouts = Objects.requireNonNull(blackouts, "blackouts");
        this.tx = Objects.requireNonNull(tx, "tx");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 블랙아웃 날짜 추가.
     *
     * @param clearAvailability 그날 남아 있는 윈도우를 지우고 추가. false 인데 윈도우가 있으면 겹침 충돌
     * @return 가드레일로 건너뛰면 empty
     */
    public Optional<BlackoutDate> addBlackoutDate(String instructorId, LocalDate date, String reason,
                                                  boolean clearAvailability, String actorId) throws Exception {
        LocalDate today = engine.guard().localToday(instructorId);
        PastEditGuard.Decision decision = engine.guard().check(date, today);
        if (decision != PastEditGuard.Decision.ALLOW) {
            log.warn("Skipping blackout on past date instructor={} date={} ({})", instructorId, date, decision);
            return Optional.empty();
        }

        LocalDate weekStart = WeekBits.mondayOf(date);
        String actor = actorId == null ? instructorId : actorId;

        Added added = tx.required(() -> {
            if (blackouts.find(instructorId, date).isPresent()) {
                throw new BlackoutConflictException(date);
            }
            WeekBits before = store.getWeek(instructorId, weekStart);
            DayBits existing = before.day(date);
            WeekBits after = before;
            if (!existing.isEmpty()) {
                if (!clearAvailability) {
                    Window first = BitCodec.decode(existing).get(0);
                    throw new OverlapConflictException(date, first, Window.wholeDay());
                }
                store.upsertWeek(instructorId, weekStart, Map.of(date, DayBits.EMPTY));
                after = before.with(date, DayBits.EMPTY);
            }

            BlackoutDate b = BlackoutDate.ofNew(UUID.randomUUID().toString(), instructorId, date, reason, clock.now());
            if (!blackouts.insert(b)) {
                throw new BlackoutConflictException(date);
            }
            engine.appendAudit(AuditRecord.ACTION_BLACKOUT_ADDED, instructorId, actor, weekStart,
                    List.of(date), before, after);
            boolean cleared = !existing.isEmpty();
            if (cleared) {
                engine.enqueueWeekSaved(instructorId, weekStart, List.of(date),
                        WeekVersions.compute(after), today);
            }
            return new Added(b, after, cleared);
        });

        if (added.cleared()) {
            engine.refreshCache(instructorId, weekStart, added.week());
        }
        log.info("Blackout added instructor={} date={} clearedAvailability={}", instructorId, date, added.cleared());
        return Optional.of(added.blackout());
    }

    /** 강사 로컬 오늘 이후(포함) 블랙아웃, 날짜 오름차순 */
    public List<BlackoutDate> getFutureBlackoutDates(String instructorId) throws Exception {
        LocalDate today = engine.guard().localToday(instructorId);
        return tx.required(() -> blackouts.findFrom(instructorId, today));
    }

    public boolean deleteBlackoutDate(String instructorId, String blackoutId, String actorId) throws Exception {
        String actor = actorId == null ? instructorId : actorId;
        boolean deleted = tx.required(() -> {
            Optional<BlackoutDate> found = blackouts.findById(instructorId, blackoutId);
            if (found.isEmpty()) return false;
            if (!blackouts.delete(instructorId, blackoutId)) return false;

            LocalDate date = found.get().date();
            LocalDate weekStart = WeekBits.mondayOf(date);
            WeekBits week = store.getWeek(instructorId, weekStart);
            engine.appendAudit(AuditRecord.ACTION_BLACKOUT_DELETED, instructorId, actor, weekStart,
                    List.of(date), week, week);
            return true;
        });
        if (deleted) {
            log.info("Blackout deleted instructor={} id={}", instructorId, blackoutId);
        } else {
            log.debug("Blackout not found instructor={} id={}", instructorId, blackoutId);
        }
        return deleted;
    }

    private record Added(BlackoutDate blackout, WeekBits week, boolean cleared) {}
}
