package net.openhours.core.error;

import net.openhours.core.model.Window;

import java.time.LocalDate;

/** 같은 날의 두 윈도우가 비트 단위로 겹침 (신규-신규 또는 신규-기존) */
public class OverlapConflictException extends AvailabilityException {
    private final LocalDate date;
    private final Window first;
    private final Window second;

    public OverlapConflictException(LocalDate date, Window first, Window second) {
        super("Overlapping windows on " + date + ": " + first.display() + " and " + second.display());
        this.date = date;
        this.first = first;
        this.second = second;
    }

    public LocalDate date() { return date; }
    public Window first() { return first; }
    public Window second() { return second; }

    @Override
    public String code() { return "overlap_conflict"; }
}
