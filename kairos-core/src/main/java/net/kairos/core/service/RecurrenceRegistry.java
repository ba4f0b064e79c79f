package net.kairos.core.service;

import net.kairos.core.model.Job;
import net.kairos.core.model.RecurrenceKind;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.support.IsolatedTask;
import net.kairos.core.support.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Holds one armed trigger per enabled job. A single clock thread owns every pending tick;
 * due firings are handed to the firing executor so a slow run never holds up another tick.
 */
public final class RecurrenceRegistry {
    private static final Logger log = LoggerFactory.getLogger(RecurrenceRegistry.class);

    /** Receives each due firing on a firing-pool thread. */
    @FunctionalInterface
    public interface FiringHandler {
        /** @param nextFireTime the re-armed cron tick, or null for one-shots */
        void onFire(Job job, Instant scheduledAt, Instant nextFireTime);
    }

    private final ConcurrentHashMap<Long, TriggerHandle> triggers = new ConcurrentHashMap<>();
    private final ScheduledThreadPoolExecutor clockThread;
    private final Executor firingPool;
    private final FiringHandler handler;
    private final CronCalculator cron;
    private final Clock clock;
    private final ZoneId zone;

    public RecurrenceRegistry(Executor firingPool, FiringHandler handler,
                              CronCalculator cron, Clock clock, ZoneId zone) {
        this.firingPool = firingPool;
        this.handler = handler;
        this.cron = cron;
        this.clock = clock;
        this.zone = zone;
        this.clockThread = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("kairos-trigger"));
        this.clockThread.setRemoveOnCancelPolicy(true);
    }

    /**
     * Arms (or re-arms) the job's trigger.
     *
     * @return the first instant the job is due
     * @throws JobValidationException when the schedule cannot be armed
     */
    public Instant register(Job job) {
        if (job.id() == null) throw new IllegalArgumentException("job must be persisted before it is armed");

        Instant first;
        if (job.recurrence() == RecurrenceKind.CRON) {
            try {
                cron.validate(job.schedule());
                first = cron.next(clock.now(), job.schedule(), zone);
            } catch (RuntimeException e) {
                throw new JobValidationException("invalid cron expression '" + job.schedule() + "': " + e.getMessage(), e);
            }
        } else if (job.recurrence() == RecurrenceKind.ONCE) {
            first = parseOnce(job.schedule());
            if (!first.isAfter(clock.now())) {
                throw new JobValidationException("schedule time is in the past: " + job.schedule());
            }
        } else {
            throw new JobValidationException("unsupported recurrence: " + job.recurrence());
        }

        TriggerHandle handle = new TriggerHandle(job);
        TriggerHandle previous = triggers.put(job.id(), handle);
        if (previous != null) previous.cancel();
        if (!handle.arm(first)) {
            log.warn("scheduler is stopped, job '{}' (id={}) stored but not armed", job.name(), job.id());
            return first;
        }
        log.info("armed job '{}' (id={}, {} '{}'), first run at {}",
                job.name(), job.id(), job.recurrence(), job.schedule(), first);
        return first;
    }

    /** @return whether a pending trigger was cancelled */
    public boolean deregister(long jobId) {
        TriggerHandle handle = triggers.remove(jobId);
        if (handle == null) return false;
        boolean cancelled = handle.cancel();
        if (cancelled) log.info("disarmed job '{}' (id={})", handle.job.name(), jobId);
        return cancelled;
    }

    public boolean isArmed(long jobId) {
        return triggers.containsKey(jobId);
    }

    public Optional<Instant> nextFireTime(long jobId) {
        TriggerHandle handle = triggers.get(jobId);
        return handle == null ? Optional.empty() : Optional.ofNullable(handle.nextFireTime());
    }

    public int armedCount() {
        return triggers.size();
    }

    /** Cancels every pending tick and stops the clock thread. Running firings are left alone. */
    public void shutdown() {
        triggers.values().forEach(TriggerHandle::cancel);
        triggers.clear();
        clockThread.shutdownNow();
    }

    /** Parses an ISO-8601 offset timestamp such as {@code 2030-01-01T09:00:00+09:00}. */
    public static Instant parseOnce(String schedule) {
        if (schedule == null || schedule.isBlank()) throw new JobValidationException("schedule is required");
        try {
            return OffsetDateTime.parse(schedule.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new JobValidationException("invalid one-shot time '" + schedule + "', expected RFC 3339", e);
        }
    }

    private void tick(TriggerHandle handle, Instant scheduledAt) {
        Job job = handle.job;
        Instant following;
        synchronized (handle) {
            if (handle.cancelled || triggers.get(job.id()) != handle) return;
            if (job.recurrence() == RecurrenceKind.ONCE) {
                handle.cancelled = true;
                triggers.remove(job.id(), handle);
                following = null;
            } else {
                following = following(job, scheduledAt);
                if (following == null) {
                    handle.cancelled = true;
                    triggers.remove(job.id(), handle);
                }
            }
        }

        try {
            firingPool.execute(IsolatedTask.of("job " + job.name(),
                    () -> handler.onFire(job, scheduledAt, following)));
        } catch (RejectedExecutionException e) {
            log.warn("firing pool rejected job '{}' due at {}", job.name(), scheduledAt);
        }

        if (following != null) handle.arm(following);
    }

    private Instant following(Job job, Instant scheduledAt) {
        try {
            Instant next = cron.next(scheduledAt, job.schedule(), zone);
            Instant now = clock.now();
            // ticks missed while the clock thread was starved are skipped, not replayed
            if (!next.isAfter(now)) next = cron.next(now, job.schedule(), zone);
            return next;
        } catch (RuntimeException e) {
            log.error("cannot compute next run of job '{}', trigger dropped", job.name(), e);
            return null;
        }
    }

    private final class TriggerHandle {
        private final Job job;
        private ScheduledFuture<?> future;
        private Instant nextFireTime;
        private boolean cancelled;

        TriggerHandle(Job job) {
            this.job = job;
        }

        /** @return false when the trigger clock no longer accepts ticks; the handle is dropped then */
        synchronized boolean arm(Instant at) {
            if (cancelled) return false;
            nextFireTime = at;
            long delay = Math.max(0, Duration.between(clock.now(), at).toMillis());
            try {
                future = clockThread.schedule(() -> tick(this, at), delay, TimeUnit.MILLISECONDS);
                return true;
            } catch (RejectedExecutionException e) {
                cancelled = true;
                triggers.remove(job.id(), this);
                log.debug("trigger clock stopped, job '{}' not armed", job.name());
                return false;
            }
        }

        synchronized boolean cancel() {
            if (cancelled) return false;
            cancelled = true;
            if (future != null) future.cancel(false);
            return true;
        }

        synchronized Instant nextFireTime() {
            return nextFireTime;
        }
    }
}
