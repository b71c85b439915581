package net.openhours.core.config;

import java.time.ZoneId;
import java.util.Objects;

/**
 * 오래된 day 행 정리 정책.
 *
 * @param retentionDays  이 일수보다 오래된 행이 정리 후보
 * @param keepRecentDays TTL 과 무관하게 항상 남겨두는 최근 일수
 * @param dryRun         true 면 개수만 세고 지우지 않음
 */
public record RetentionConfig(
        boolean enabled,
        int retentionDays,
        int keepRecentDays,
        boolean dryRun,
        ZoneId zone
) {
    public RetentionConfig {
        if (retentionDays < 0 || keepRecentDays < 0) {
            throw new IllegalArgumentException("retention days must be >= 0");
        }
        Objects.requireNonNull(zone, "zone");
    }

    public static RetentionConfig disabled() {
        return new RetentionConfig(false, 180, 30, false, ZoneId.of("UTC"));
    }

    /** 실제로 적용되는 보존 일수 */
    public int effectiveDays() {
        return Math.max(retentionDays, keepRecentDays);
    }
}
