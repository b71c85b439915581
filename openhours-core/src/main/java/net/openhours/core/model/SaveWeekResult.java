package net.openhours.core.model;

import java.time.LocalDate;
import java.util.List;

public record SaveWeekResult(
        LocalDate weekStart,
        int daysWritten,
        int rowsWritten,
        String version,
        int skippedPastForbidden,
        int skippedPastWindow,
        List<LocalDate> writtenDates,
        List<LocalDate> skippedDates
) {
    public SaveWeekResult {
        writtenDates = List.copyOf(writtenDates);
        skippedDates = List.copyOf(skippedDates);
    }

    /** 가드레일로 전부 건너뛴 경우 등: 아무것도 쓰지 않음 */
    public static SaveWeekResult nothingWritten(LocalDate weekStart, String version,
                                                int skippedForbidden, int skippedWindow,
                                                List<LocalDate> skippedDates) {
        return new SaveWeekResult(weekStart, 0, 0, version, skippedForbidden, skippedWindow, List.of(), skippedDates);
    }
}
