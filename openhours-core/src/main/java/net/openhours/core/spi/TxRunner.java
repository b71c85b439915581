package net.openhours.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. 주간 upsert + 감사 + outbox 는 하나의 required() 안에서 실행된다.
 * 구현: JdbcTxRunner(ThreadLocal 커넥션), SpringTxRunner(PlatformTransactionManager).
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션을 보류하고 항상 새 트랜잭션 */
    <T> T requiresNew(Callable<T> body) throws Exception;

    /** 트랜잭션 없이 바로 실행 (인메모리 저장소/단위 테스트용) */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
            @Override public <T> T requiresNew(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
