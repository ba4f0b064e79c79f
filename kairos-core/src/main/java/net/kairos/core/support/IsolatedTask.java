package net.kairos.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a body on a pool thread so that nothing it throws can reach the pool
 * or any other task. Everything is logged with its stack trace.
 */
public final class IsolatedTask implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(IsolatedTask.class);

    private final String label;
    private final Runnable body;

    private IsolatedTask(String label, Runnable body) {
        this.label = label;
        this.body = body;
    }

    public static IsolatedTask of(String label, Runnable body) {
        return new IsolatedTask(label, body);
    }

    @Override
    public void run() {
        try {
            body.run();
        } catch (Throwable t) {
            log.error("task '{}' failed", label, t);
        }
    }

    @Override
    public String toString() {
        return "IsolatedTask[" + label + "]";
    }
}
