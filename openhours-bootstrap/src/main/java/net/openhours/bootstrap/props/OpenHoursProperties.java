package net.openhours.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("openhours")
public class OpenHoursProperties {
    /** 강사별 타임존 리졸버가 없을 때 모든 강사에 쓰는 타임존 */
    private String zone = "UTC";
    private Guardrails guardrails = new Guardrails();
    private Cache cache = new Cache();
    private Retention retention = new Retention();
    private Audit audit = new Audit();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Guardrails getGuardrails() {
        return guardrails;
    }

    public void setGuardrails(Guardrails guardrails) {
        this.guardrails = guardrails;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public static class Guardrails {
        private boolean forbidPastEdits = true;
        private int pastEditWindowDays = 0;
        private boolean clampCopyToFuture = true;
        private boolean suppressPastEvents = false;
        private boolean requireBaseVersion = false;
        private int slotMinutes = 30;

        public boolean isForbidPastEdits() {
            return forbidPastEdits;
        }

        public void setForbidPastEdits(boolean forbidPastEdits) {
            this.forbidPastEdits = forbidPastEdits;
        }

        public int getPastEditWindowDays() {
            return pastEditWindowDays;
        }

        public void setPastEditWindowDays(int pastEditWindowDays) {
            this.pastEditWindowDays = pastEditWindowDays;
        }

        public boolean isClampCopyToFuture() {
            return clampCopyToFuture;
        }

        public void setClampCopyToFuture(boolean clampCopyToFuture) {
            this.clampCopyToFuture = clampCopyToFuture;
        }

        public boolean isSuppressPastEvents() {
            return suppressPastEvents;
        }

        public void setSuppressPastEvents(boolean suppressPastEvents) {
            this.suppressPastEvents = suppressPastEvents;
        }

        public boolean isRequireBaseVersion() {
            return requireBaseVersion;
        }

        public void setRequireBaseVersion(boolean requireBaseVersion) {
            this.requireBaseVersion = requireBaseVersion;
        }

        public int getSlotMinutes() {
            return slotMinutes;
        }

        public void setSlotMinutes(int slotMinutes) {
            this.slotMinutes = slotMinutes;
        }
    }

    public static class Cache {
        private boolean enabled = true;
        private long maximumSize = 50_000;
        private Duration hotTtl = Duration.ofMinutes(5);
        private Duration warmTtl = Duration.ofHours(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public Duration getHotTtl() {
            return hotTtl;
        }

        public void setHotTtl(Duration hotTtl) {
            this.hotTtl = hotTtl;
        }

        public Duration getWarmTtl() {
            return warmTtl;
        }

        public void setWarmTtl(Duration warmTtl) {
            this.warmTtl = warmTtl;
        }
    }

    public static class Retention {
        private boolean enabled = false;
        private int retentionDays = 180;
        private int keepRecentDays = 30;
        private boolean dryRun = false;
        private long delayMs = 3_600_000;
        private long initialDelayMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public int getKeepRecentDays() {
            return keepRecentDays;
        }

        public void setKeepRecentDays(int keepRecentDays) {
            this.keepRecentDays = keepRecentDays;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }
    }

    public static class Audit {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
