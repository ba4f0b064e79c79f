package net.kairos.core.model;

import java.time.Duration;
import java.time.Instant;

public record ExecutionLog(
        Long id,
        Long jobId,
        Status status,
        Instant startedAt,
        Instant endedAt,
        long durationSeconds,    // whole seconds, truncated
        String output,
        String error,
        int retriesConsumed
) {
    public enum Status {
        FAILURE(0), SUCCESS(1);

        private final int code;

        Status(int code) { this.code = code; }

        public int code() { return code; }

        public static Status fromCode(int code) {
            return code == 1 ? SUCCESS : FAILURE;
        }
    }

    /** A log opened at the start of a firing; nothing is known about the outcome yet. */
    public static ExecutionLog started(long jobId, Instant startedAt) {
        return new ExecutionLog(null, jobId, Status.FAILURE, startedAt, null, 0, null, null, 0);
    }

    public ExecutionLog finish(Instant endedAt, String output, String error, int retriesConsumed) {
        long seconds = Duration.between(startedAt, endedAt).getSeconds();
        Status st = error == null ? Status.SUCCESS : Status.FAILURE;
        return new ExecutionLog(id, jobId, st, startedAt, endedAt, Math.max(seconds, 0), output, error, retriesConsumed);
    }

    public ExecutionLog withId(Long id) {
        return new ExecutionLog(id, jobId, status, startedAt, endedAt, durationSeconds, output, error, retriesConsumed);
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
