package net.openhours.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** 디코드된 주간 뷰. version 은 다음 저장 시 baseVersion 으로 돌려받는다 */
public record WeekAvailability(
        String instructorId,
        LocalDate weekStart,
        String version,
        Map<LocalDate, List<Window>> days
) {
    public List<Window> windowsOn(LocalDate date) {
        return days.getOrDefault(date, List.of());
    }
}
