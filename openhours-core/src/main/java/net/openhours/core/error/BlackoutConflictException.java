package net.openhours.core.error;

import java.time.LocalDate;

public class BlackoutConflictException extends AvailabilityException {
    private final LocalDate date;

    public BlackoutConflictException(LocalDate date) {
        super("Blackout date already exists: " + date);
        this.date = date;
    }

    public LocalDate date() { return date; }

    @Override
    public String code() { return "blackout_conflict"; }
}
