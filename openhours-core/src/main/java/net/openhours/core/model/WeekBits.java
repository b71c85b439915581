package net.openhours.core.model;

import net.openhours.core.bits.DayBits;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** ISO 주(월요일 시작) 7일치 비트. 빠진 날은 항상 EMPTY 로 채워져 있다 */
public record WeekBits(LocalDate weekStart, List<DayBits> days) {
    public static final int DAYS = 7;

    public WeekBits {
        Objects.requireNonNull(weekStart, "weekStart");
        if (days.size() != DAYS) throw new IllegalArgumentException("week needs 7 days, got " + days.size());
        days = List.copyOf(days);
    }

    public static WeekBits empty(LocalDate weekStart) {
        return new WeekBits(weekStart, Collections.nCopies(DAYS, DayBits.EMPTY));
    }

    /** 누락된 날짜는 EMPTY. 주 밖의 날짜는 무시한다 */
    public static WeekBits of(LocalDate weekStart, Map<LocalDate, DayBits> byDate) {
        List<DayBits> list = new ArrayList<>(DAYS);
        for (int i = 0; i < DAYS; i++) {
            DayBits b = byDate.get(weekStart.plusDays(i));
            list.add(b == null ? DayBits.EMPTY : b);
        }
        return new WeekBits(weekStart, list);
    }

    public static LocalDate mondayOf(LocalDate date) {
        return date.minusDays(date.getDayOfWeek().getValue() - DayOfWeek.MONDAY.getValue());
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(weekStart) && date.isBefore(weekStart.plusDays(DAYS));
    }

    public DayBits day(LocalDate date) {
        if (!contains(date)) throw new IllegalArgumentException(date + " is outside week " + weekStart);
        return days.get((int) (date.toEpochDay() - weekStart.toEpochDay()));
    }

    public WeekBits with(LocalDate date, DayBits bits) {
        if (!contains(date)) throw new IllegalArgumentException(date + " is outside week " + weekStart);
        List<DayBits> copy = new ArrayList<>(days);
        copy.set((int) (date.toEpochDay() - weekStart.toEpochDay()), bits);
        return new WeekBits(weekStart, copy);
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>(DAYS);
        for (int i = 0; i < DAYS; i++) out.add(weekStart.plusDays(i));
        return out;
    }

    public Map<LocalDate, DayBits> asMap() {
        Map<LocalDate, DayBits> m = new LinkedHashMap<>();
        for (int i = 0; i < DAYS; i++) m.put(weekStart.plusDays(i), days.get(i));
        return m;
    }
}
