package net.kairos.core.exec;

import java.time.Duration;

/** Monotonic per-attempt deadline. */
public final class Deadline {
    private final Duration timeout;
    private final long expiresAtNanos;

    private Deadline(Duration timeout, long expiresAtNanos) {
        this.timeout = timeout;
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration timeout) {
        return new Deadline(timeout, System.nanoTime() + timeout.toNanos());
    }

    public Duration timeout() { return timeout; }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    public boolean expired() { return expiresAtNanos - System.nanoTime() <= 0; }

    @Override public String toString() {
        return "Deadline{timeout=" + timeout + ", remaining=" + remaining() + '}';
    }
}
