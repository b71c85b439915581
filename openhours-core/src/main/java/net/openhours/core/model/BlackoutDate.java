package net.openhours.core.model;

import java.time.Instant;
import java.time.LocalDate;

public record BlackoutDate(
        String id,
        String instructorId,
        LocalDate date,
        String reason,
        Instant createdAt
) {
    public static BlackoutDate ofNew(String id, String instructorId, LocalDate date, String reason, Instant now) {
        return new BlackoutDate(id, instructorId, date, reason, now);
    }
}
