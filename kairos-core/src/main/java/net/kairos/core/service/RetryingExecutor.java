package net.kairos.core.service;

import net.kairos.core.exec.CommandRunner;
import net.kairos.core.exec.CommandRunners;
import net.kairos.core.exec.Deadline;
import net.kairos.core.exec.ExecutionFailureException;
import net.kairos.core.exec.ExecutionTimeoutException;
import net.kairos.core.exec.RunOutcome;
import net.kairos.core.model.Job;
import net.kairos.core.support.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a job's command up to {@code retryTimes + 1} times. Each attempt is bounded by
 * {@code timeoutSeconds}; a fixed pause of {@code retryDelaySeconds} separates attempts.
 */
public final class RetryingExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);

    /** Extra wait past the deadline before an attempt is abandoned. */
    static final Duration GRACE = Duration.ofMillis(250);

    private final CommandRunners runners;
    private final ExecutorService attempts;

    public RetryingExecutor(CommandRunners runners) {
        this.runners = runners;
        this.attempts = Executors.newCachedThreadPool(new NamedThreadFactory("kairos-attempt"));
    }

    public RunOutcome run(Job job) {
        CommandRunner runner = runners.forKind(job.execution()).orElse(null);
        if (runner == null) {
            return new RunOutcome(null, "unsupported execution kind: " + job.execution(), 0, false);
        }

        RetryPolicy retry = RetryPolicy.fixed(Duration.ofSeconds(Math.max(job.retryDelaySeconds(), 0)));
        Duration timeout = Duration.ofSeconds(job.timeoutSeconds());

        String output = null;
        String error = null;
        boolean timedOut = false;
        int last = 0;

        for (int attempt = 0; attempt <= Math.max(job.retryTimes(), 0); attempt++) {
            if (attempt > 0) {
                Duration backoff = retry.nextBackoff(attempt);
                log.info("job '{}' attempt {} failed ({}), retrying in {}s", job.name(), attempt, error, backoff.toSeconds());
                try {
                    TimeUnit.MILLISECONDS.sleep(backoff.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            last = attempt;
            try {
                output = attempt(runner, job, timeout);
                return new RunOutcome(output, null, attempt, false);
            } catch (ExecutionTimeoutException e) {
                log.warn("job '{}' attempt {} timed out after {}s", job.name(), attempt, timeout.toSeconds());
                output = e.output();
                error = e.getMessage();
                timedOut = true;
            } catch (ExecutionFailureException e) {
                output = e.output();
                error = e.getMessage();
                timedOut = false;
            }
            if (Thread.currentThread().isInterrupted()) break;
        }
        return new RunOutcome(output, error, last, timedOut);
    }

    private String attempt(CommandRunner runner, Job job, Duration timeout) throws ExecutionFailureException {
        Deadline deadline = Deadline.after(timeout);
        Future<String> future = attempts.submit(() -> runner.run(job, deadline));
        try {
            return future.get(timeout.plus(GRACE).toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExecutionTimeoutException(timeout, null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExecutionFailureException) throw (ExecutionFailureException) cause;
            throw new ExecutionFailureException(String.valueOf(cause), null, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionFailureException("execution interrupted", null, e);
        }
    }

    public void shutdown() {
        attempts.shutdownNow();
    }
}
