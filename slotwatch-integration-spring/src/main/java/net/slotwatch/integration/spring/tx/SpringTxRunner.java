package net.slotwatch.integration.spring.tx;

import net.slotwatch.adapter.jdbc.TxContext;
import net.slotwatch.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 매니저 위에서 도는 TxRunner.
 * 스프링이 잡은 커넥션을 TxContext 에 꽂아 JDBC 리포지토리가 그대로 쓰게 한다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate requiredTpl;
    private final TransactionTemplate requiresNewTpl;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.ds = ds;
        this.requiredTpl = new TransactionTemplate(tm);
        this.requiredTpl.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNewTpl = new TransactionTemplate(tm);
        this.requiresNewTpl.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.active()) {
            // 이미 TxContext가 있으면 그대로 참여 (중첩 호출)
            return body.call();
        }
        return execute(requiredTpl, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNewTpl, body);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) throws Exception {
        Connection suspended = TxContext.get();
        try {
            return tpl.execute(status -> {
                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    // 롤백을 위해 감싸고, 밖에서 원래 예외로 되돌린다
                    throw new BodyFailure(e);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (BodyFailure f) {
            throw f.checked;
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private static final class BodyFailure extends RuntimeException {
        private final Exception checked;

        BodyFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
