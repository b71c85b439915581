package net.openhours.core.error;

/** 낡은 동시성 토큰. 호출자가 주간 데이터를 다시 읽고 재시도해야 한다 (내부 재시도 없음). */
public class VersionConflictException extends AvailabilityException {
    private final String expectedVersion;
    private final String currentVersion;

    public VersionConflictException(String expectedVersion, String currentVersion) {
        super("Week was modified by another writer (expected version " + expectedVersion
                + ", current " + currentVersion + "); refetch the week and retry");
        this.expectedVersion = expectedVersion;
        this.currentVersion = currentVersion;
    }

    public String expectedVersion() { return expectedVersion; }
    public String currentVersion() { return currentVersion; }

    @Override
    public String code() { return "version_conflict"; }
}
