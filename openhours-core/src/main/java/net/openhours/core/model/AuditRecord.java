package net.openhours.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** 커밋된 쓰기의 부수효과로만 생성 (append-only) */
public record AuditRecord(
        String auditId,
        Instant occurredAt,
        String instructorId,
        String actorId,
        String action,
        LocalDate weekStart,
        List<LocalDate> targetDates,
        Map<LocalDate, List<Window>> before,
        Map<LocalDate, List<Window>> after
) {
    public static final String ACTION_WEEK_SAVED = "availability.week_saved";
    public static final String ACTION_BLACKOUT_ADDED = "availability.blackout_added";
    public static final String ACTION_BLACKOUT_DELETED = "availability.blackout_deleted";
}
