package net.openhours.core.spi;

import net.openhours.core.bits.DayBits;
import net.openhours.core.model.DayAvailability;
import net.openhours.core.model.WeekBits;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * (강사, 날짜)별 비트 벡터 저장소. 비즈니스 검증 없음 (순수 기계적 저장).
 * 쓰기 메서드는 호출자의 트랜잭션(TxRunner) 안에서 실행되어야 한다.
 */
public interface DayStore {
    Optional<DayAvailability> getDay(String instructorId, LocalDate date) throws Exception;

    /** 항상 7일. 행이 없는 날은 EMPTY */
    WeekBits getWeek(String instructorId, LocalDate weekStart) throws Exception;

    /** 주 안의 여러 날을 한 배치로 upsert (전부 아니면 전무). 반환: 쓴 행 수 */
    int upsertWeek(String instructorId, LocalDate weekStart, Map<LocalDate, DayBits> days) throws Exception;

    boolean clear(String instructorId, LocalDate date) throws Exception;

    int clearWeek(String instructorId, LocalDate weekStart) throws Exception;

    // 보존 기간 정리용
    long countOlderThan(LocalDate cutoff) throws Exception;

    int deleteOlderThan(LocalDate cutoff) throws Exception;
}
