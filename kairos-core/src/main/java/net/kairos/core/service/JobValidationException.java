package net.kairos.core.service;

/** A job definition was rejected before anything was stored or armed. */
public class JobValidationException extends IllegalArgumentException {
    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
