package net.kairos.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** Pause before the given attempt (1-based retry index). */
    Duration nextBackoff(long attempt);

    static RetryPolicy fixed(Duration backoff) {
        return new FixedRetryPolicy(backoff);
    }
}
