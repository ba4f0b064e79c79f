package net.kairos.core.service;

import net.kairos.core.exec.RunOutcome;
import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.RecurrenceKind;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobStore;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * One firing of one job: run with retries, then record log, stats and job state,
 * then send the callback. Each persistence step runs even when an earlier one failed.
 */
public final class JobFiringService {
    private static final Logger log = LoggerFactory.getLogger(JobFiringService.class);

    private final JobStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final RetryingExecutor executor;
    private final StatsAggregator stats;
    private final CallbackNotifier notifier;

    public JobFiringService(JobStore store, TxRunner tx, Clock clock, RetryingExecutor executor,
                            StatsAggregator stats, CallbackNotifier notifier) {
        this.store = store;
        this.tx = tx;
        this.clock = clock;
        this.executor = executor;
        this.stats = stats;
        this.notifier = notifier;
    }

    public ExecutionLog fire(Job job, FiringSource source, Instant nextFireTime) {
        ExecutionLog started = ExecutionLog.started(job.id(), clock.now());
        log.info("job '{}' started ({})", job.name(), source);

        RunOutcome outcome = executor.run(job);
        ExecutionLog finished = started.finish(clock.now(), outcome.output(), outcome.error(), outcome.retriesConsumed());
        if (finished.succeeded()) {
            log.info("job '{}' succeeded in {}s after {} retries", job.name(), finished.durationSeconds(), outcome.retriesConsumed());
        } else {
            log.warn("job '{}' failed after {} retries: {}", job.name(), outcome.retriesConsumed(), outcome.error());
        }

        ExecutionLog saved = finished;
        try {
            saved = tx.required(() -> store.createLog(finished));
        } catch (Exception e) {
            log.error("could not save execution log of job '{}'", job.name(), e);
        }

        try {
            stats.update(job.id(), saved, outcome.timedOut());
        } catch (Exception e) {
            log.error("could not update stats of job '{}'", job.name(), e);
        }

        try {
            tx.required(() -> {
                updateJobState(job, source, started.startedAt(), nextFireTime);
                return null;
            });
        } catch (Exception e) {
            log.error("could not update state of job '{}'", job.name(), e);
        }

        notifier.notifyAsync(job, saved);
        return saved;
    }

    private void updateJobState(Job fired, FiringSource source, Instant ranAt, Instant nextFireTime) throws Exception {
        Optional<Job> current = store.findById(fired.id());
        if (current.isEmpty()) {
            log.debug("job {} was removed while running, state not updated", fired.id());
            return;
        }
        Job stored = current.get();
        // a job rescheduled while this firing ran keeps its new schedule state
        boolean sameSchedule = stored.recurrence() == fired.recurrence()
                && stored.schedule().equals(fired.schedule());
        Instant next = null;
        boolean disable = false;
        if (source == FiringSource.SCHEDULED && sameSchedule) {
            if (stored.recurrence() == RecurrenceKind.ONCE) {
                disable = true;
            } else {
                next = nextFireTime;
            }
        }
        store.updateRunState(fired.id(), ranAt, next, disable, clock.now());
    }
}
