package net.openhours.core.maintenance;

import net.openhours.core.config.RetentionConfig;
import net.openhours.core.spi.Clock;
import net.openhours.core.spi.DayStore;
import net.openhours.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;

public final class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final DayStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final RetentionConfig config;

    public RetentionService(DayStore store, TxRunner tx, Clock clock, RetentionConfig config) {
        this.store = store;
        this.tx = tx;
        this.clock = clock;
        this.config = config;
    }

    /**
     * 주기 정리 메인 루틴.
     * - 비활성이면 아무것도 하지 않음
     * - cutoff = 오늘 - max(retentionDays, keepRecentDays)
     * - dryRun 이면 개수만 센다
     */
    public RetentionReport purgeOnce() throws Exception {
        Instant now = clock.now();
        RetentionReport r = new RetentionReport();
        r.timestamp = now;
        r.dryRun = config.dryRun();
        if (!config.enabled()) {
            log.debug("retention disabled, skipping");
            return r;
        }

        LocalDate today = now.atZone(config.zone()).toLocalDate();
        LocalDate cutoff = today.minusDays(config.effectiveDays());
        r.cutoff = cutoff;

        r.candidates = tx.required(() -> store.countOlderThan(cutoff));
        if (!config.dryRun() && r.candidates > 0) {
            r.deleted = tx.required(() -> store.deleteOlderThan(cutoff));
        }

        log.info("Retention purge cutoff={} candidates={} deleted={} dryRun={}",
                cutoff, r.candidates, r.deleted, r.dryRun);
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class RetentionReport {
        public Instant timestamp;
        public LocalDate cutoff;
        public boolean dryRun;
        public long candidates;
        public int deleted;

        @Override public String toString() {
            return "RetentionReport{" +
                    "timestamp=" + timestamp +
                    ", cutoff=" + cutoff +
                    ", dryRun=" + dryRun +
                    ", candidates=" + candidates +
                    ", deleted=" + deleted +
                    '}';
        }
    }
}
