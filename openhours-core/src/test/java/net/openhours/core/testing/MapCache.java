package net.openhours.core.testing;

import net.openhours.core.spi.AvailabilityCache;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** TTL 은 기록만 하고 만료시키지 않는 캐시 */
public class MapCache implements AvailabilityCache {
    public final Map<String, Object> entries = new ConcurrentHashMap<>();
    public final Map<String, Duration> ttls = new ConcurrentHashMap<>();

    public static String fullKey(Namespace ns, String key) {
        return ns.prefix() + ":" + key;
    }

    @Override
    public <T> Optional<T> get(Namespace ns, String key, Class<T> type) {
        Object v = entries.get(fullKey(ns, key));
        return type.isInstance(v) ? Optional.of(type.cast(v)) : Optional.empty();
    }

    @Override
    public void set(Namespace ns, String key, Object value, Duration ttl) {
        entries.put(fullKey(ns, key), value);
        ttls.put(fullKey(ns, key), ttl);
    }

    @Override
    public void invalidate(Namespace ns, String key) {
        entries.remove(fullKey(ns, key));
        ttls.remove(fullKey(ns, key));
    }
}
