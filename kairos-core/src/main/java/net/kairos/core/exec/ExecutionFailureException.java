package net.kairos.core.exec;

/** A command or protocol level failure of one attempt. Carries whatever output was captured. */
public class ExecutionFailureException extends Exception {
    private final String output;

    public ExecutionFailureException(String message, String output) {
        super(message);
        this.output = output;
    }

    public ExecutionFailureException(String message, String output, Throwable cause) {
        super(message, cause);
        this.output = output;
    }

    public String output() {
        return output;
    }
}
