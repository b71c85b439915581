package net.openhours.integration.spring.tx;

import net.openhours.adapter.jdbc.TxContext;
import net.openhours.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 JDBC 어댑터를 돌린다.
 * 스프링이 잡은 물리 커넥션을 TxContext 에 꽂아서, 레포지토리는 JdbcTxRunner 때와 똑같이 동작.
 * body 의 checked 예외는 롤백 후 그대로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, body);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) throws Exception {
        try {
            return tpl.execute(status -> bound(body));
        } catch (CheckedBodyFailure f) {
            throw f.checked;
        }
    }

    private <T> T bound(Callable<T> body) {
        // REQUIRES_NEW 면 바깥 커넥션을 잠시 치워두고 끝나면 되돌린다
        Connection outer = TxContext.get();
        Connection con = DataSourceUtils.getConnection(ds);
        try {
            TxContext.set(con);
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyFailure(e);
        } finally {
            if (outer != null) TxContext.set(outer);
            else TxContext.clear();
            DataSourceUtils.releaseConnection(con, ds);
        }
    }

    /** TransactionTemplate 이 롤백하도록 checked 예외를 잠시 감싼다 */
    private static final class CheckedBodyFailure extends RuntimeException {
        final Exception checked;

        CheckedBodyFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
