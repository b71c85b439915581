package net.openhours.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** 주간 뷰 + 날짜별 반시간 슬롯 목록 (그리드 UI 용) */
public record WeekSlots(
        WeekAvailability availability,
        Map<LocalDate, List<Window>> slots
) {
    public List<Window> slotsOn(LocalDate date) {
        return slots.getOrDefault(date, List.of());
    }
}
