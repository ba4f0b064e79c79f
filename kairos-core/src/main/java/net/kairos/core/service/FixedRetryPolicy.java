package net.kairos.core.service;

import java.time.Duration;

final class FixedRetryPolicy implements RetryPolicy {
    private final Duration backoff;

    FixedRetryPolicy(Duration backoff) {
        if (backoff == null || backoff.isNegative()) throw new IllegalArgumentException("backoff must be >= 0");
        this.backoff = backoff;
    }

    @Override public Duration nextBackoff(long attempt) { return backoff; }
}
