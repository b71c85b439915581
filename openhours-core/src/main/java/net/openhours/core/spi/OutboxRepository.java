package net.openhours.core.spi;

import net.openhours.core.model.OutboxEvent;

import java.util.List;

public interface OutboxRepository {
    /** 내구성 있는 enqueue. 쓰기와 같은 트랜잭션에서 호출 (at-least-once) */
    void enqueue(OutboxEvent event) throws Exception;

    /** 외부 디스패처용: 미전송 이벤트 오래된 순 */
    List<OutboxEvent> findPending(int limit) throws Exception;

    void markSent(String eventId) throws Exception;
}
