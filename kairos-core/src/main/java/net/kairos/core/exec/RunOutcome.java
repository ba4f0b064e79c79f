package net.kairos.core.exec;

/**
 * Result of a whole retry loop. {@code error} is null on success; otherwise it and
 * {@code output} come from the last attempt.
 */
public record RunOutcome(String output, String error, int retriesConsumed, boolean timedOut) {
    public boolean succeeded() {
        return error == null;
    }
}
