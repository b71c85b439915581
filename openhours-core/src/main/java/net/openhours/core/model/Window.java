package net.openhours.core.model;

import net.openhours.core.error.AvailabilityValidationException;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * 하루 안의 반열림 구간 [start, end), 자정 기준 분 단위.
 * end = 1440 은 "24:00:00" (그날의 끝)이며 다음 날 00:00 이 아니다.
 */
public record Window(int startMinute, int endMinute) implements Comparable<Window> {
    public static final int END_OF_DAY = 24 * 60;
    public static final String END_OF_DAY_TEXT = "24:00:00";

    public Window {
        if (startMinute < 0 || startMinute >= END_OF_DAY) {
            throw new AvailabilityValidationException("start out of range: " + startMinute + " min");
        }
        if (endMinute <= startMinute || endMinute > END_OF_DAY) {
            throw new AvailabilityValidationException(
                    "end must be after start: " + text(startMinute) + "-" + text(endMinute));
        }
    }

    /** wire 포맷 "HH:MM:SS" 파싱. "24:00:00" 은 end 에만 허용, 00:00 end 는 그날의 끝 */
    public static Window parse(String start, String end) {
        int s = parseMinute(start, false);
        int e = parseMinute(end, true);
        if (e == 0 && s > 0) e = END_OF_DAY;
        return new Window(s, e);
    }

    public static Window of(LocalTime start, LocalTime end) {
        int s = start.getHour() * 60 + start.getMinute();
        int e = end.getHour() * 60 + end.getMinute();
        // 00:00 이 end 로 오면 자정(그날의 끝)으로 본다
        if (e == 0 && s > 0) e = END_OF_DAY;
        return new Window(s, e);
    }

    public static Window wholeDay() {
        return new Window(0, END_OF_DAY);
    }

    /** "HH:MM[:SS]" → 자정 기준 분. endSide 일 때만 "24:00:00" 허용 */
    public static int parseMinute(String value, boolean endSide) {
        if (value == null || value.isBlank()) {
            throw new AvailabilityValidationException("time value is required");
        }
        String v = value.trim();
        if (v.equals(END_OF_DAY_TEXT) || v.equals("24:00")) {
            if (!endSide) {
                throw new AvailabilityValidationException("24:00:00 is only valid as an end time");
            }
            return END_OF_DAY;
        }
        try {
            LocalTime t = LocalTime.parse(v);
            if (t.getSecond() != 0 || t.getNano() != 0) {
                throw new AvailabilityValidationException("seconds are not supported: " + v);
            }
            return t.getHour() * 60 + t.getMinute();
        } catch (DateTimeParseException e) {
            throw new AvailabilityValidationException("invalid time: " + v, e);
        }
    }

    public static String text(int minute) {
        if (minute == END_OF_DAY) return END_OF_DAY_TEXT;
        return String.format("%02d:%02d:00", minute / 60, minute % 60);
    }

    public String start() { return text(startMinute); }

    public String end() { return text(endMinute); }

    public boolean endsAtEndOfDay() { return endMinute == END_OF_DAY; }

    public int lengthMinutes() { return endMinute - startMinute; }

    public boolean intersects(Window other) {
        return startMinute < other.endMinute && other.startMinute < endMinute;
    }

    public String display() { return "(" + start() + ", " + end() + ")"; }

    @Override
    public int compareTo(Window o) {
        int c = Integer.compare(startMinute, o.startMinute);
        return c != 0 ? c : Integer.compare(endMinute, o.endMinute);
    }
}
