package net.openhours.core.spi;

import java.time.Instant;

/** 현재 시각 주입점. 테스트에서는 고정 시각 람다로 대체 */
@FunctionalInterface
public interface Clock {
    Instant now();

    static Clock fixed(Instant at) {
        return () -> at;
    }
}
