package net.openhours.core.model;

import net.openhours.core.bits.DayBits;

import java.time.Instant;
import java.time.LocalDate;

/** (강사, 날짜) 한 행. 행이 없으면 그날은 전부 불가 */
public record DayAvailability(
        String instructorId,
        LocalDate date,
        DayBits bits,
        Instant updatedAt
) {
    public static DayAvailability empty(String instructorId, LocalDate date) {
        return new DayAvailability(instructorId, date, DayBits.EMPTY, null);
    }
}
