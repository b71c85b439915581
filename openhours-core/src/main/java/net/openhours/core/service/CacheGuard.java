package net.openhours.core.service;

import net.openhours.core.bits.DayBits;
import net.openhours.core.model.WeekBits;
import net.openhours.core.spi.AvailabilityCache;
import net.openhours.core.spi.AvailabilityCache.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;

/**
 * 캐시 호출 래퍼. 캐시가 없거나(null) 실패하면 miss 로 취급하고 로그만 남긴다.
 * 어떤 경우에도 호출자에게 캐시 예외를 던지지 않는다.
 */
public final class CacheGuard {
    private static final Logger log = LoggerFactory.getLogger(CacheGuard.class);

    private final AvailabilityCache cache;

    public CacheGuard(AvailabilityCache cache) {
        this.cache = cache;
    }

    public boolean enabled() {
        return cache != null;
    }

    public static String weekKey(String instructorId, LocalDate weekStart) {
        return instructorId + ":" + weekStart;
    }

    public static String dayKey(String instructorId, LocalDate date) {
        return instructorId + ":" + date;
    }

    public Optional<WeekBits> getWeek(String instructorId, LocalDate weekStart) {
        return get(Namespace.WEEK_BITS, weekKey(instructorId, weekStart), WeekBits.class);
    }

    public Optional<DayBits> getDay(String instructorId, LocalDate date) {
        return get(Namespace.DAY_BITS, dayKey(instructorId, date), DayBits.class);
    }

    /** 합성 주간 + 날짜별 엔트리 모두 채움 */
    public void putWeek(String instructorId, WeekBits week, Duration ttl) {
        set(Namespace.WEEK_BITS, weekKey(instructorId, week.weekStart()), week, ttl);
        week.asMap().forEach((date, bits) -> set(Namespace.DAY_BITS, dayKey(instructorId, date), bits, ttl));
    }

    public void putDay(String instructorId, LocalDate date, DayBits bits, Duration ttl) {
        set(Namespace.DAY_BITS, dayKey(instructorId, date), bits, ttl);
    }

    public void invalidateWeek(String instructorId, LocalDate weekStart, Collection<LocalDate> dates) {
        invalidate(Namespace.WEEK_BITS, weekKey(instructorId, weekStart));
        for (LocalDate d : dates) {
            invalidate(Namespace.DAY_BITS, dayKey(instructorId, d));
        }
    }

    private <T> Optional<T> get(Namespace ns, String key, Class<T> type) {
        if (cache == null) return Optional.empty();
        try {
            Optional<T> hit = cache.get(ns, key, type);
            if (hit == null) hit = Optional.empty();
            log.debug("cache {} {}:{}", hit.isPresent() ? "hit" : "miss", ns.prefix(), key);
            return hit;
        } catch (Exception e) {
            log.warn("cache get failed {}:{}, falling back to store: {}", ns.prefix(), key, e.toString());
            return Optional.empty();
        }
    }

    private void set(Namespace ns, String key, Object value, Duration ttl) {
        if (cache == null) return;
        try {
            cache.set(ns, key, value, ttl);
        } catch (Exception e) {
            log.warn("cache set failed {}:{}: {}", ns.prefix(), key, e.toString());
        }
    }

    private void invalidate(Namespace ns, String key) {
        if (cache == null) return;
        try {
            cache.invalidate(ns, key);
        } catch (Exception e) {
            log.warn("cache invalidate failed {}:{}: {}", ns.prefix(), key, e.toString());
        }
    }
}
