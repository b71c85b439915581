package net.openhours.core.testing;

import net.openhours.core.bits.DayBits;
import net.openhours.core.model.DayAvailability;
import net.openhours.core.model.WeekBits;
import net.openhours.core.spi.Clock;
import net.openhours.core.spi.DayStore;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** 테스트용 DayStore. 키 = "instructor|date" */
public class InMemoryDayStore implements DayStore {
    private final Map<String, DayAvailability> rows = new ConcurrentHashMap<>();
    private final Clock clock;

    public final AtomicInteger upsertCalls = new AtomicInteger();
    public final AtomicInteger weekReads = new AtomicInteger();
    public volatile boolean failReads;
    public volatile boolean failUpserts;

    public InMemoryDayStore() {
        this(Instant::now);
    }

    public InMemoryDayStore(Clock clock) {
        this.clock = clock;
    }

    private static String key(String instructorId, LocalDate date) {
        return instructorId + "|" + date;
    }

    /** 저장소에 직접 심기 (엔진 우회) */
    public void put(String instructorId, LocalDate date, DayBits bits) {
        rows.put(key(instructorId, date), new DayAvailability(instructorId, date, bits, clock.now()));
    }

    public int size() {
        return rows.size();
    }

    @Override
    public Optional<DayAvailability> getDay(String instructorId, LocalDate date) {
        if (failReads) throw new IllegalStateException("store read failure");
        return Optional.ofNullable(rows.get(key(instructorId, date)));
    }

    @Override
    public WeekBits getWeek(String instructorId, LocalDate weekStart) {
        if (failReads) throw new IllegalStateException("store read failure");
        weekReads.incrementAndGet();
        Map<LocalDate, DayBits> m = new LinkedHashMap<>();
        for (int i = 0; i < WeekBits.DAYS; i++) {
            DayAvailability row = rows.get(key(instructorId, weekStart.plusDays(i)));
            if (row != null) m.put(row.date(), row.bits());
        }
        return WeekBits.of(weekStart, m);
    }

    @Override
    public int upsertWeek(String instructorId, LocalDate weekStart, Map<LocalDate, DayBits> days) {
        if (failUpserts) throw new IllegalStateException("store write failure");
        upsertCalls.incrementAndGet();
        Instant now = clock.now();
        days.forEach((d, bits) -> rows.put(key(instructorId, d), new DayAvailability(instructorId, d, bits, now)));
        return days.size();
    }

    @Override
    public boolean clear(String instructorId, LocalDate date) {
        return rows.remove(key(instructorId, date)) != null;
    }

    @Override
    public int clearWeek(String instructorId, LocalDate weekStart) {
        int n = 0;
        for (int i = 0; i < WeekBits.DAYS; i++) {
            if (clear(instructorId, weekStart.plusDays(i))) n++;
        }
        return n;
    }

    @Override
    public long countOlderThan(LocalDate cutoff) {
        return rows.values().stream().filter(r -> r.date().isBefore(cutoff)).count();
    }

    @Override
    public int deleteOlderThan(LocalDate cutoff) {
        int n = 0;
        for (Iterator<DayAvailability> it = rows.values().iterator(); it.hasNext(); ) {
            if (it.next().date().isBefore(cutoff)) { it.remove(); n++; }
        }
        return n;
    }
}
