package net.openhours.core.testing;

import net.openhours.core.spi.AvailabilityCache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** 모든 호출이 실패하는 캐시 (백엔드 장애 흉내) */
public class FailingCache implements AvailabilityCache {
    public final AtomicInteger calls = new AtomicInteger();

    @Override
    public <T> Optional<T> get(Namespace ns, String key, Class<T> type) throws Exception {
        calls.incrementAndGet();
        throw new java.io.IOException("cache backend down");
    }

    @Override
    public void set(Namespace ns, String key, Object value, Duration ttl) throws Exception {
        calls.incrementAndGet();
        throw new java.io.IOException("cache backend down");
    }

    @Override
    public void invalidate(Namespace ns, String key) throws Exception {
        calls.incrementAndGet();
        throw new java.io.IOException("cache backend down");
    }
}
