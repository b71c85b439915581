package net.openhours.integration.spring.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import net.openhours.core.spi.AvailabilityCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * 프로세스 로컬 2계층 캐시 (Caffeine).
 * 키 = "avail:day:{강사}:{날짜}" / "avail:week:{강사}:{주}", TTL 은 엔트리마다 다르다 (hot/warm).
 */
public final class CaffeineAvailabilityCache implements AvailabilityCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAvailabilityCache.class);

    private final Cache<String, Entry> cache;

    public CaffeineAvailabilityCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker(), null);
    }

    /** 테스트용: 가짜 ticker + 동기 executor */
    CaffeineAvailabilityCache(long maximumSize, Ticker ticker, Executor executor) {
        Caffeine<Object, Object> b = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker);
        if (executor != null) b.executor(executor);
        this.cache = b.expireAfter(new PerEntryTtl()).build();
    }

    private static String fullKey(Namespace ns, String key) {
        return ns.prefix() + ":" + key;
    }

    @Override
    public <T> Optional<T> get(Namespace ns, String key, Class<T> type) {
        Entry e = cache.getIfPresent(fullKey(ns, key));
        if (e == null) return Optional.empty();
        if (!type.isInstance(e.value())) {
            log.debug("Cache entry {} has type {}, expected {}", fullKey(ns, key),
                    e.value().getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(e.value()));
    }

    @Override
    public void set(Namespace ns, String key, Object value, Duration ttl) {
        if (value == null || ttl.isZero() || ttl.isNegative()) return;
        cache.put(fullKey(ns, key), new Entry(value, ttl.toNanos()));
    }

    @Override
    public void invalidate(Namespace ns, String key) {
        cache.invalidate(fullKey(ns, key));
    }

    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(Object value, long ttlNanos) {}

    private static final class PerEntryTtl implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        // 읽기는 만료를 늘리지 않는다
        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
