package net.kairos.bootstrap.autoconfigure;

import net.kairos.bootstrap.catalog.CatalogRegistrar;
import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.exec.CommandRunners;
import net.kairos.core.model.JobDefaults;
import net.kairos.core.service.JobScheduler;
import net.kairos.core.service.SchedulerSettings;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.JobStore;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.KairosSpringConfig;
import net.kairos.integration.spring.cron.CronUtilsCalculator;
import net.kairos.integration.spring.sched.KairosSchedulerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.ZoneId;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class})
@EnableConfigurationProperties(KairosProperties.class)
@Import(KairosSpringConfig.class) // integration-spring: store/tx/clock wiring
public class KairosAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KairosAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandRunners commandRunners() {
        return CommandRunners.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings schedulerSettings(KairosProperties props) {
        var d = props.getDefaults();
        JobDefaults defaults = new JobDefaults(
                (int) d.getTimeout().toSeconds(), d.getRetryTimes(), (int) d.getRetryDelay().toSeconds());
        return new SchedulerSettings(ZoneId.of(props.getZone()), defaults, props.getCallback().getTimeout());
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobStore store, TxRunner tx, Clock clock, CronCalculator cron,
                                     CommandRunners runners, SchedulerSettings settings) {
        return new JobScheduler(store, tx, clock, cron, runners, settings);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kairos.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public KairosSchedulerLifecycle kairosSchedulerLifecycle(JobScheduler scheduler) {
        return new KairosSchedulerLifecycle(scheduler);
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobScheduler scheduler) {
        return new CatalogRegistrar(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kairos.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, KairosProperties props) {
        log.info("[Kairos] catalog: {} job(s) declared", props.getCatalog().getJobs().size());
        return args -> registrar.register(props.getCatalog());
    }
}
