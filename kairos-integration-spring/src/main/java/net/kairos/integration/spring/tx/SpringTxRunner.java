package net.kairos.integration.spring.tx;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** Runs bodies in Spring-managed transactions and exposes the bound connection through {@link TxContext}. */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);

        return tpl.execute(status -> {
            // joined transaction: the outer body already bound the connection
            if (TxContext.get() != null) {
                return call(body);
            }

            Connection con = DataSourceUtils.getConnection(ds);
            try {
                TxContext.set(con);
                return call(body);
            } finally {
                TxContext.clear();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
