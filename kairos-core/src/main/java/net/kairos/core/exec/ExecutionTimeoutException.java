package net.kairos.core.exec;

import java.time.Duration;

public class ExecutionTimeoutException extends ExecutionFailureException {
    private static final String MARKER = "execution timed out";

    public ExecutionTimeoutException(Duration bound, String output) {
        super(MARKER + " (" + bound.toSeconds() + " seconds)", output);
    }
}
