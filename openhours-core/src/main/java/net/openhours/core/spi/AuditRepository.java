package net.openhours.core.spi;

import net.openhours.core.model.AuditRecord;

import java.util.List;

public interface AuditRepository {
    /** append-only. 쓰기와 같은 트랜잭션에서 호출 */
    void append(AuditRecord record) throws Exception;

    List<AuditRecord> findRecent(String instructorId, int limit) throws Exception;
}
