package net.openhours.core.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * 2계층 캐시: 날짜별 원시 비트(DAY_BITS)와 주 단위 합성 뷰(WEEK_BITS).
 * 엔진은 구현이 없을 수도, 실패할 수도 있다고 가정한다 (CacheGuard 가 흡수).
 */
public interface AvailabilityCache {
    enum Namespace {
        DAY_BITS("avail:day"),
        WEEK_BITS("avail:week");

        private final String prefix;

        Namespace(String prefix) { this.prefix = prefix; }

        public String prefix() { return prefix; }
    }

    <T> Optional<T> get(Namespace ns, String key, Class<T> type) throws Exception;

    void set(Namespace ns, String key, Object value, Duration ttl) throws Exception;

    void invalidate(Namespace ns, String key) throws Exception;
}
