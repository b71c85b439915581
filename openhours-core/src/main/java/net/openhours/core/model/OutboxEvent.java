package net.openhours.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** 주 단위 저장 1회당 정확히 1건. 전달은 외부 책임 */
public record OutboxEvent(
        String eventId,
        String eventType,
        String instructorId,
        LocalDate weekStart,
        List<LocalDate> dates,
        String version,
        Instant createdAt
) {
    public static final String WEEK_SAVED = "availability.week_saved";

    /** 같은 (강사, 주, 버전) 재전송은 같은 키 → 소비자 측 멱등 처리 */
    public String idempotencyKey() {
        return instructorId + ":" + weekStart + ":" + version;
    }
}
