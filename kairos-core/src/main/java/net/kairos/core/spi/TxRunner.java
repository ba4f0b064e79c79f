package net.kairos.core.spi;

import java.util.concurrent.Callable;

/** Runs a body inside a transaction; nested calls join the outer one. */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;

    /** Runs the body in place; for stores that need no transaction (in-memory). */
    static TxRunner direct() {
        return new TxRunner() {
            @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }
        };
    }
}
