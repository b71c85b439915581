package net.openhours.integration.spring.cache;

import net.openhours.core.bits.DayBits;
import net.openhours.core.config.EngineConfig;
import net.openhours.core.model.SaveWeekRequest;
import net.openhours.core.model.WeekBits;
import net.openhours.core.spi.AvailabilityCache.Namespace;
import net.openhours.core.testing.EngineFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicLong;

import static net.openhours.core.testing.EngineFixture.INSTRUCTOR;
import static net.openhours.core.testing.EngineFixture.NEXT_MONDAY;
import static org.assertj.core.api.Assertions.assertThat;

class CaffeineAvailabilityCacheTest {

    final AtomicLong nanos = new AtomicLong();
    final CaffeineAvailabilityCache cache = new CaffeineAvailabilityCache(1_000, nanos::get, Runnable::run);

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }

    @Test
    void entriesExpireAfterTheirOwnTtl() {
        cache.set(Namespace.DAY_BITS, "i:2025-03-10", DayBits.FULL, Duration.ofMinutes(5));
        cache.set(Namespace.DAY_BITS, "i:2025-01-06", DayBits.FULL, Duration.ofHours(1));

        advance(Duration.ofMinutes(6));

        assertThat(cache.get(Namespace.DAY_BITS, "i:2025-03-10", DayBits.class)).isEmpty();
        assertThat(cache.get(Namespace.DAY_BITS, "i:2025-01-06", DayBits.class)).contains(DayBits.FULL);
    }

    @Test
    void readsDoNotExtendTtl() {
        cache.set(Namespace.DAY_BITS, "k", DayBits.FULL, Duration.ofMinutes(5));
        advance(Duration.ofMinutes(4));
        assertThat(cache.get(Namespace.DAY_BITS, "k", DayBits.class)).isPresent();

        advance(Duration.ofMinutes(2));
        assertThat(cache.get(Namespace.DAY_BITS, "k", DayBits.class)).isEmpty();
    }

    @Test
    void namespacesAreSeparate_andTypeMismatchIsAMiss() {
        LocalDate mon = LocalDate.of(2025, 3, 10);
        cache.set(Namespace.WEEK_BITS, "i:" + mon, WeekBits.empty(mon), Duration.ofMinutes(5));

        assertThat(cache.get(Namespace.DAY_BITS, "i:" + mon, DayBits.class)).isEmpty();
        assertThat(cache.get(Namespace.WEEK_BITS, "i:" + mon, DayBits.class)).isEmpty();
        assertThat(cache.get(Namespace.WEEK_BITS, "i:" + mon, WeekBits.class)).contains(WeekBits.empty(mon));

        cache.invalidate(Namespace.WEEK_BITS, "i:" + mon);
        assertThat(cache.get(Namespace.WEEK_BITS, "i:" + mon, WeekBits.class)).isEmpty();
    }

    @Test
    void nonPositiveTtl_isNotStored() {
        cache.set(Namespace.DAY_BITS, "k", DayBits.FULL, Duration.ZERO);
        assertThat(cache.estimatedSize()).isZero();
    }

    @Test
    void engineReadsThroughCaffeine() throws Exception {
        EngineFixture f = EngineFixture.create(EngineConfig.defaults(), cache);
        LocalDate tue = NEXT_MONDAY.plusDays(1);

        f.engine.saveWeekBits(SaveWeekRequest.builder(INSTRUCTOR, NEXT_MONDAY)
                .window(tue, "09:00:00", "12:00:00")
                .build());
        int reads = f.store.weekReads.get();

        WeekBits week = f.engine.getWeekBits(INSTRUCTOR, NEXT_MONDAY, true);

        assertThat(week.day(tue).cardinality()).isEqualTo(6);
        assertThat(f.store.weekReads.get()).isEqualTo(reads);
        assertThat(f.admission.validate(INSTRUCTOR, tue, "09:30:00", "11:00:00").available()).isTrue();

        // hot TTL(기본 5분) 지나면 저장소로 간다
        advance(Duration.ofMinutes(6));
        f.engine.getWeekBits(INSTRUCTOR, NEXT_MONDAY, true);
        assertThat(f.store.weekReads.get()).isEqualTo(reads + 1);
    }
}
