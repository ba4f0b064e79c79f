package net.kairos.core.service;

import net.kairos.core.exec.CommandRunners;
import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobStats;
import net.kairos.core.model.RecurrenceKind;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.JobStore;
import net.kairos.core.spi.TxRunner;
import net.kairos.core.support.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for managing jobs. Keeps the store and the armed triggers in step:
 * every enabled job in the store has exactly one trigger once {@link #start()} ran.
 */
public final class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final JobValidator validator;
    private final StatsAggregator stats;
    private final RetryingExecutor executor;
    private final JobFiringService firing;
    private final RecurrenceRegistry registry;
    private final ExecutorService firingPool;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    public JobScheduler(JobStore store, TxRunner tx, Clock clock, CronCalculator cron,
                        CommandRunners runners, SchedulerSettings settings) {
        this.store = store;
        this.tx = tx;
        this.clock = clock;
        this.validator = new JobValidator(cron, clock, settings.defaults(), settings.zone());
        this.stats = new StatsAggregator(store, tx, clock);
        this.executor = new RetryingExecutor(runners);
        this.firingPool = Executors.newCachedThreadPool(new NamedThreadFactory("kairos-fire"));
        CallbackNotifier notifier = new CallbackNotifier(
                HttpClient.newBuilder().connectTimeout(settings.callbackTimeout()).build(),
                firingPool, settings.callbackTimeout());
        this.firing = new JobFiringService(store, tx, clock, executor, stats, notifier);
        this.registry = new RecurrenceRegistry(firingPool,
                (job, scheduledAt, next) -> firing.fire(job, FiringSource.SCHEDULED, next),
                cron, clock, settings.zone());
    }

    /** Arms every enabled job in the store. Jobs that can no longer be armed are logged and skipped. */
    public void start() throws Exception {
        if (stopped.get()) throw new IllegalStateException("scheduler was stopped");
        if (!started.compareAndSet(false, true)) return;
        List<Job> jobs = tx.required(store::listAll);
        int armed = 0;
        for (Job job : jobs) {
            if (!job.enabled()) continue;
            try {
                Instant first = registry.register(job);
                if (job.recurrence() == RecurrenceKind.CRON) {
                    tx.required(() -> { store.save(job.withNextRunAt(first)); return null; });
                }
                armed++;
            } catch (Exception e) {
                log.warn("job '{}' (id={}) not armed at start-up: {}", job.name(), job.id(), e.getMessage());
            }
        }
        log.info("scheduler started, {} of {} jobs armed", armed, jobs.size());
    }

    /** Disarms every trigger. Firings already running finish on their own. */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        registry.shutdown();
        firingPool.shutdown();
        executor.shutdown();
        log.info("scheduler stopped");
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public Job addJob(Job job) throws Exception {
        Job valid = validator.validate(job.withId(null));
        Instant now = clock.now();
        Job created;
        try {
            created = tx.required(() -> {
                if (store.findByName(valid.name()).isPresent()) {
                    throw new JobValidationException("job name already exists: " + valid.name());
                }
                return store.create(valid.withLastRunAt(null).withTimestamps(now, now));
            });
        } catch (JobValidationException e) {
            throw e;
        } catch (Exception e) {
            // a concurrent add of the same name won the insert
            if (tx.required(() -> store.findByName(valid.name())).isPresent()) {
                throw new JobValidationException("job name already exists: " + valid.name(), e);
            }
            throw e;
        }

        if (!created.enabled()) return created;
        Instant first;
        try {
            first = registry.register(created);
        } catch (RuntimeException e) {
            tx.required(() -> { store.delete(created.id()); return null; });
            throw e;
        }
        if (created.recurrence() == RecurrenceKind.CRON) {
            Job withNext = created.withNextRunAt(first);
            tx.required(() -> { store.save(withNext); return null; });
            return withNext;
        }
        return created;
    }

    public Job updateJob(Job job) throws Exception {
        if (job.id() == null) throw new JobValidationException("job id is required for update");
        long id = job.id();
        Job valid = validator.validate(job);

        Job saved = tx.required(() -> {
            Job existing = store.findById(id).orElseThrow(() -> new JobNotFoundException(id));
            Optional<Job> clash = store.findByName(valid.name());
            if (clash.isPresent() && !clash.get().id().equals(id)) {
                throw new JobValidationException("job name already exists: " + valid.name());
            }
            Job merged = valid.withLastRunAt(existing.lastRunAt())
                    .withTimestamps(existing.createdAt(), clock.now());
            registry.deregister(id);
            store.save(merged);
            return merged;
        });

        if (!saved.enabled()) return saved;
        Instant first = registry.register(saved);
        if (saved.recurrence() == RecurrenceKind.CRON) {
            Job withNext = saved.withNextRunAt(first);
            tx.required(() -> { store.save(withNext); return null; });
            return withNext;
        }
        return saved;
    }

    public void removeJob(long id) throws Exception {
        tx.required(() -> {
            store.findById(id).orElseThrow(() -> new JobNotFoundException(id));
            registry.deregister(id);
            store.delete(id);
            return null;
        });
        stats.forget(id);
        log.info("removed job {}", id);
    }

    /** Fires the job once on the firing pool, outside its schedule. */
    public CompletableFuture<ExecutionLog> runNow(Job job) {
        if (job.id() == null) throw new JobValidationException("job must be saved before it can run");
        return CompletableFuture.supplyAsync(() -> firing.fire(job, FiringSource.MANUAL, null), firingPool)
                .whenComplete((r, e) -> {
                    if (e != null) log.error("manual run of job '{}' failed", job.name(), e);
                });
    }

    public CompletableFuture<ExecutionLog> runNow(long id) throws Exception {
        Job job = tx.required(() -> store.findById(id)).orElseThrow(() -> new JobNotFoundException(id));
        return runNow(job);
    }

    public List<Job> listJobs() throws Exception {
        return tx.required(store::listAll);
    }

    public Optional<Job> getJob(long id) throws Exception {
        return tx.required(() -> store.findById(id));
    }

    public Optional<Job> getJobByName(String name) throws Exception {
        return tx.required(() -> store.findByName(name));
    }

    public List<ExecutionLog> getLogs(long id) throws Exception {
        return tx.required(() -> store.listLogs(id));
    }

    public Optional<JobStats> getStats(long id) throws Exception {
        return tx.required(() -> store.getStats(id));
    }

    public List<JobStats> getAllStats() throws Exception {
        return tx.required(store::listAllStats);
    }

    /** Trigger view, mainly for operators and tests. */
    public Optional<Instant> nextFireTime(long id) {
        return registry.nextFireTime(id);
    }

    public boolean isArmed(long id) {
        return registry.isArmed(id);
    }
}
