package net.openhours.core.model;

import net.openhours.core.error.AvailabilityValidationException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 주 단위 저장 요청.
 *
 * <p>windowsByDay 의 키 유무가 의미를 가진다:
 * 키가 없는 날은 그대로 두고, 빈 리스트로 들어온 날은 비운다 (병합 플래그와 무관).
 *
 * @param baseVersion          마지막으로 읽은 주간 버전. null = 토큰 없음
 * @param override             true 면 버전 비교를 건너뛴다
 * @param clearExisting        주 단위 교체: 제출된 모든 날을 제출 내용만으로 다시 만든다
 * @param clearDates           날짜 단위 교체 (clearExisting=false 일 때 일부 날만 교체)
 * @param ignoreExistingOverlap 기존 윈도우와의 겹침 검사를 생략 (합집합으로 흡수)
 */
public record SaveWeekRequest(
        String instructorId,
        LocalDate weekStart,
        Map<LocalDate, List<WindowInput>> windowsByDay,
        String baseVersion,
        boolean override,
        boolean clearExisting,
        Set<LocalDate> clearDates,
        boolean ignoreExistingOverlap,
        String actorId
) {
    public SaveWeekRequest {
        if (instructorId == null || instructorId.isBlank()) {
            throw new AvailabilityValidationException("instructorId is required");
        }
        if (weekStart == null) throw new AvailabilityValidationException("weekStart is required");
        windowsByDay = windowsByDay == null ? Map.of() : copy(windowsByDay);
        if (clearDates != null && clearDates.stream().anyMatch(Objects::isNull)) {
            throw new AvailabilityValidationException("clear date is required");
        }
        clearDates = clearDates == null ? Set.of() : Set.copyOf(clearDates);
        if (actorId == null) actorId = instructorId;
    }

    public boolean replaces(LocalDate date) {
        return clearExisting || clearDates.contains(date);
    }

    public static Builder builder(String instructorId, LocalDate weekStart) {
        return new Builder(instructorId, weekStart);
    }

    private static Map<LocalDate, List<WindowInput>> copy(Map<LocalDate, List<WindowInput>> src) {
        Map<LocalDate, List<WindowInput>> m = new LinkedHashMap<>();
        src.forEach((d, ws) -> m.put(d, ws == null ? List.of() : List.copyOf(ws)));
        return Collections.unmodifiableMap(m);
    }

    public static final class Builder {
        private final String instructorId;
        private final LocalDate weekStart;
        private final Map<LocalDate, List<WindowInput>> windows = new LinkedHashMap<>();
        private final Set<LocalDate> clearDates = new LinkedHashSet<>();
        private String baseVersion;
        private boolean override;
        private boolean clearExisting;
        private boolean ignoreExistingOverlap;
        private String actorId;

        private Builder(String instructorId, LocalDate weekStart) {
            this.instructorId = instructorId;
            this.weekStart = weekStart;
        }

        public Builder window(LocalDate date, String start, String end) {
            windows.computeIfAbsent(date, d -> new ArrayList<>()).add(WindowInput.of(start, end));
            return this;
        }

        public Builder windows(LocalDate date, List<WindowInput> list) {
            windows.computeIfAbsent(date, d -> new ArrayList<>()).addAll(list);
            return this;
        }

        /** 빈 리스트로 날짜를 명시 → 그날을 비운다 */
        public Builder emptyDay(LocalDate date) {
            windows.computeIfAbsent(date, d -> new ArrayList<>());
            return this;
        }

        public Builder baseVersion(String v) { this.baseVersion = v; return this; }
        public Builder override(boolean v) { this.override = v; return this; }
        public Builder clearExisting(boolean v) { this.clearExisting = v; return this; }
        public Builder clearDate(LocalDate d) { this.clearDates.add(d); return this; }
        public Builder ignoreExistingOverlap(boolean v) { this.ignoreExistingOverlap = v; return this; }
        public Builder actor(String actorId) { this.actorId = actorId; return this; }

        public SaveWeekRequest build() {
            return new SaveWeekRequest(instructorId, weekStart, windows, baseVersion, override,
                    clearExisting, clearDates, ignoreExistingOverlap, actorId);
        }
    }
}
