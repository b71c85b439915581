package net.openhours.core.spi;

import java.time.ZoneId;

/** 강사별 타임존 조회. 강사 로컬 "오늘" 계산에 사용 (강사당 타임존 1개) */
@FunctionalInterface
public interface InstructorZoneResolver {
    ZoneId zoneOf(String instructorId) throws Exception;

    static InstructorZoneResolver fixed(ZoneId zone) {
        return instructorId -> zone;
    }
}
