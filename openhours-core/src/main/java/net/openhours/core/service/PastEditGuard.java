package net.openhours.core.service;

import net.openhours.core.config.EngineConfig;
import net.openhours.core.spi.Clock;
import net.openhours.core.spi.InstructorZoneResolver;

import java.time.LocalDate;
import java.time.ZoneId;

/** 과거 날짜 편집 가드레일. 실패가 아니라 "건너뛰고 집계" 로 처리된다 */
public final class PastEditGuard {
    public enum Decision {
        ALLOW,
        SKIP_FORBIDDEN,     // 오늘 이전 + 과거 편집 금지
        SKIP_WINDOW         // 허용 과거 일수 밖
    }

    private final EngineConfig config;
    private final Clock clock;
    private final InstructorZoneResolver zones;

    public PastEditGuard(EngineConfig config, Clock clock, InstructorZoneResolver zones) {
        this.config = config;
        this.clock = clock;
        this.zones = zones;
    }

    /** 강사 타임존 기준 오늘 */
    public LocalDate localToday(String instructorId) throws Exception {
        ZoneId zone = zones.zoneOf(instructorId);
        return clock.now().atZone(zone).toLocalDate();
    }

    public Decision check(LocalDate date, LocalDate today) {
        return check(date, today, false);
    }

    /**
     * @param clampToToday 복사/패턴 적용처럼 과거 대상을 항상 막아야 하는 경로
     */
    public Decision check(LocalDate date, LocalDate today, boolean clampToToday) {
        if (!date.isBefore(today)) return Decision.ALLOW;
        if (config.forbidPastEdits() || clampToToday) return Decision.SKIP_FORBIDDEN;
        int window = config.pastEditWindowDays();
        if (window > 0 && date.isBefore(today.minusDays(window))) return Decision.SKIP_WINDOW;
        return Decision.ALLOW;
    }
}
