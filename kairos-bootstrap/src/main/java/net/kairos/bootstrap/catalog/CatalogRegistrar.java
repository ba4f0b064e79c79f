package net.kairos.bootstrap.catalog;

import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;
import net.kairos.core.model.RecurrenceKind;
import net.kairos.core.service.JobScheduler;
import net.kairos.core.service.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/** Upserts the jobs declared under {@code kairos.catalog.jobs}, matched by name. */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobScheduler scheduler;

    public CatalogRegistrar(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    /** @return number of entries registered; rejected entries are logged and skipped */
    public int register(KairosProperties.Catalog catalog) throws Exception {
        int registered = 0;
        for (var def : catalog.getJobs()) {
            try {
                upsert(def);
                registered++;
            } catch (JobValidationException e) {
                log.error("Catalog job '{}' rejected: {}", def.getName(), e.getMessage());
            }
        }
        log.info("Catalog registered: {} of {} jobs", registered, catalog.getJobs().size());
        return registered;
    }

    private void upsert(KairosProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getSchedule() == null || def.getCommand() == null) {
            throw new JobValidationException("catalog job needs name, schedule and command");
        }
        Job job = toJob(def);
        Optional<Job> existing = scheduler.getJobByName(job.name());
        if (existing.isPresent()) {
            scheduler.updateJob(job.withId(existing.get().id()));
            log.info("Catalog updated: job='{}'", def.getName());
        } else {
            scheduler.addJob(job);
            log.info("Catalog added: job='{}'", def.getName());
        }
    }

    static Job toJob(KairosProperties.JobDef def) {
        return Job.ofNew(def.getName().trim(),
                        RecurrenceKind.from(def.getRecurrence()),
                        def.getSchedule(),
                        ExecutionKind.from(def.getExecution()),
                        def.getCommand())
                .withDescription(def.getDescription())
                .withEnabled(def.isEnabled())
                .withHttp(def.getMethod(), def.getHeaders(), def.getBody())
                // unset values fall through to kairos.defaults
                .withTimeout(seconds(def.getTimeout(), 0))
                .withRetry(def.getRetryTimes() == null ? -1 : def.getRetryTimes(), seconds(def.getRetryDelay(), -1))
                .withCallback(def.getCallbackUrl(), def.getCallbackMethod(), def.getCallbackHeaders(), def.getCallbackBody());
    }

    private static int seconds(Duration d, int unset) {
        return d == null ? unset : (int) d.toSeconds();
    }
}
