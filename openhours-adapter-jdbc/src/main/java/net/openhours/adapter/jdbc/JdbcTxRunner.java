package net.openhours.adapter.jdbc;

import net.openhours.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * ThreadLocal 커넥션 기반 트랜잭션. 저장소 구현들은 {@link TxContext#require()} 로 커넥션을 얻는다.
 * 주간 upsert + 감사 + outbox 가 같은 커넥션/커밋에 묶인다.
 */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 트랜잭션을 '정지' / 새 커넥션으로 대체 후, 종료 시 복원
        Connection suspended = TxContext.get();
        try {
            return inNewTransaction(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {            // Throwable로 롤백 보장
                rollback(c, t);
                sneakyThrow(t);                 // 검사/비검사 구분없이 재던짐
                return null; // unreachable
            } finally {
                TxContext.clear();              // 반드시 해제
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private static void rollback(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("rollback failed after {}: {}", cause.toString(), e.toString());
        }
    }

    private static void restoreAutoCommit(Connection c, boolean prevAuto) {
        try {
            c.setAutoCommit(prevAuto);
        } catch (SQLException e) {
            log.warn("could not restore autoCommit={} on pooled connection: {}", prevAuto, e.toString());
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
