package net.openhours.core.config;

import net.openhours.core.bits.BitCodec;
import net.openhours.core.bits.DayBits;

import java.time.Duration;
import java.util.Objects;

/**
 * 엔진 동작 정책. 생성 시 한 번 주입되며 전역 토글을 대신한다.
 *
 * @param forbidPastEdits    강사 로컬 오늘 이전 날짜는 건너뛰고 집계
 * @param pastEditWindowDays forbidPastEdits=false 일 때 허용하는 과거 일수 (0 = 제한 없음)
 * @param clampCopyToFuture  주 복사/패턴 적용 시 과거 대상 날짜를 건너뜀
 * @param slotMinutes        입력 윈도우 정렬 단위 (30의 배수)
 * @param requireBaseVersion true 면 override 없는 쓰기에 baseVersion 필수
 * @param suppressPastEvents 영향 날짜가 전부 과거면 outbox 이벤트 생략
 */
public record EngineConfig(
        boolean forbidPastEdits,
        int pastEditWindowDays,
        boolean clampCopyToFuture,
        int slotMinutes,
        boolean auditEnabled,
        boolean suppressPastEvents,
        boolean requireBaseVersion,
        Duration hotTtl,
        Duration warmTtl
) {
    public EngineConfig {
        if (pastEditWindowDays < 0) throw new IllegalArgumentException("pastEditWindowDays must be >= 0");
        BitCodec.checkGrid(slotMinutes);
        Objects.requireNonNull(hotTtl, "hotTtl");
        Objects.requireNonNull(warmTtl, "warmTtl");
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .forbidPastEdits(forbidPastEdits)
                .pastEditWindowDays(pastEditWindowDays)
                .clampCopyToFuture(clampCopyToFuture)
                .slotMinutes(slotMinutes)
                .auditEnabled(auditEnabled)
                .suppressPastEvents(suppressPastEvents)
                .requireBaseVersion(requireBaseVersion)
                .hotTtl(hotTtl)
                .warmTtl(warmTtl);
    }

    public static final class Builder {
        private boolean forbidPastEdits = true;
        private int pastEditWindowDays = 0;
        private boolean clampCopyToFuture = true;
        private int slotMinutes = DayBits.SLOT_MINUTES;
        private boolean auditEnabled = true;
        private boolean suppressPastEvents = false;
        private boolean requireBaseVersion = false;
        private Duration hotTtl = Duration.ofMinutes(5);
        private Duration warmTtl = Duration.ofHours(1);

        private Builder() {}

        public Builder forbidPastEdits(boolean v) { this.forbidPastEdits = v; return this; }
        public Builder pastEditWindowDays(int v) { this.pastEditWindowDays = v; return this; }
        public Builder clampCopyToFuture(boolean v) { this.clampCopyToFuture = v; return this; }
        public Builder slotMinutes(int v) { this.slotMinutes = v; return this; }
        public Builder auditEnabled(boolean v) { this.auditEnabled = v; return this; }
        public Builder suppressPastEvents(boolean v) { this.suppressPastEvents = v; return this; }
        public Builder requireBaseVersion(boolean v) { this.requireBaseVersion = v; return this; }
        public Builder hotTtl(Duration v) { this.hotTtl = v; return this; }
        public Builder warmTtl(Duration v) { this.warmTtl = v; return this; }

        public EngineConfig build() {
            return new EngineConfig(forbidPastEdits, pastEditWindowDays, clampCopyToFuture, slotMinutes,
                    auditEnabled, suppressPastEvents, requireBaseVersion, hotTtl, warmTtl);
        }
    }
}
