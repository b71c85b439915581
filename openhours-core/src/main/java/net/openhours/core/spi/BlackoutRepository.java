package net.openhours.core.spi;

import net.openhours.core.model.BlackoutDate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface BlackoutRepository {
    Optional<BlackoutDate> find(String instructorId, LocalDate date) throws Exception;

    Optional<BlackoutDate> findById(String instructorId, String blackoutId) throws Exception;

    /** from 이상 날짜, 날짜 오름차순 */
    List<BlackoutDate> findFrom(String instructorId, LocalDate from) throws Exception;

    /** [from, to] 양끝 포함 */
    List<BlackoutDate> findBetween(String instructorId, LocalDate from, LocalDate to) throws Exception;

    /** (강사, 날짜) 유니크. 중복이면 false */
    boolean insert(BlackoutDate blackout) throws Exception;

    boolean delete(String instructorId, String blackoutId) throws Exception;
}
