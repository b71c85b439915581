package net.openhours.integration.spring.sched;

import net.openhours.core.maintenance.RetentionService;
import net.openhours.core.maintenance.RetentionService.RetentionReport;
import org.springframework.scheduling.annotation.Scheduled;

/** 보존 기간 정리 주기 실행. 주기는 openhours.retention.delay-ms */
public class RetentionScheduler {
    private final RetentionService retention;
    private volatile RetentionReport lastReport;

    public RetentionScheduler(RetentionService retention) {
        this.retention = retention;
    }

    @Scheduled(initialDelayString = "${openhours.retention.initial-delay-ms:60000}",
               fixedDelayString = "${openhours.retention.delay-ms:3600000}")
    public void purge() throws Exception {
        lastReport = retention.purgeOnce();
    }

    public RetentionReport lastReport() {
        return lastReport;
    }
}
