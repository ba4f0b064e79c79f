package net.kairos.integration.spring;

import net.kairos.adapter.jdbc.JdbcJobStore;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobStore;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class KairosSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // the JDBC store reads its connection from TxContext, so it needs no DataSource of its own
    @Bean public JobStore jobStore() { return new JdbcJobStore(); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
