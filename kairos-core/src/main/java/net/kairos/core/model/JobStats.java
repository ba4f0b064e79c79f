package net.kairos.core.model;

import java.time.Instant;

public record JobStats(
        long jobId,
        long totalRuns,
        long successRuns,
        long failedRuns,
        long timeoutRuns,
        long totalDurationSeconds,
        double avgDurationSeconds,
        long retryCount,
        Instant lastSuccessAt,
        Instant lastFailureAt,
        String lastError,
        Instant updatedAt
) {
    public static JobStats empty(long jobId) {
        return new JobStats(jobId, 0, 0, 0, 0, 0, 0d, 0, null, null, null, null);
    }

    /**
     * Folds one completed run into the aggregate.
     *
     * @param timedOut whether the run ended on an attempt deadline
     */
    public JobStats record(ExecutionLog log, boolean timedOut, Instant now) {
        long total = totalRuns + 1;
        long duration = totalDurationSeconds + log.durationSeconds();
        long success = successRuns;
        long failed = failedRuns;
        long timeouts = timeoutRuns;
        Instant okAt = lastSuccessAt;
        Instant failAt = lastFailureAt;
        String err = lastError;

        if (log.succeeded()) {
            success++;
            okAt = log.endedAt();
        } else {
            failed++;
            failAt = log.endedAt();
            err = log.error();
            if (timedOut) timeouts++;
        }
        return new JobStats(jobId, total, success, failed, timeouts, duration,
                (double) duration / total, retryCount + log.retriesConsumed(),
                okAt, failAt, err, now);
    }
}
