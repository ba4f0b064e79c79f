package net.kairos.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.kairos.core.spi.TxRunner;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected DataSource ds;
    protected TxRunner tx;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("KAIROS_JDBC_URL");
        if (url == null || url.isBlank()) {
            // one private in-memory database per test class
            url = "jdbc:h2:mem:" + getClass().getSimpleName() + ";DB_CLOSE_DELAY=-1";
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername("sa");
        cfg.setPassword("");
        cfg.setMaximumPoolSize(6);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .load()
                .migrate();

        tx = new JdbcTxRunner(ds);
    }

    @BeforeEach
    void truncateAll() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                for (String t : new String[]{"TB_EXECUTION_LOG", "TB_JOB_STATS", "TB_JOB"}) {
                    st.execute("DELETE FROM " + t);
                }
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }
}
