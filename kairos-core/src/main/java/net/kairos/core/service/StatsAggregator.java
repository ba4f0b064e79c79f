package net.kairos.core.service;

import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.JobStats;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobStore;
import net.kairos.core.spi.TxRunner;

import java.util.concurrent.ConcurrentHashMap;

public final class StatsAggregator {
    private final JobStore store;
    private final TxRunner tx;
    private final Clock clock;
    private final ConcurrentHashMap<Long, Object> locks = new ConcurrentHashMap<>();

    public StatsAggregator(JobStore store, TxRunner tx, Clock clock) {
        this.store = store; this.tx = tx; this.clock = clock;
    }

    /**
     * Folds one finished firing into the job's stats row; updates for the same job never interleave.
     *
     * @param timedOut whether the firing ended on an attempt timeout
     */
    public JobStats update(long jobId, ExecutionLog log, boolean timedOut) throws Exception {
        Object lock = locks.computeIfAbsent(jobId, k -> new Object());
        synchronized (lock) {
            return tx.required(() -> {
                JobStats current = store.getStats(jobId).orElseGet(() -> JobStats.empty(jobId));
                JobStats next = current.record(log, timedOut, clock.now());
                store.upsertStats(next);
                return next;
            });
        }
    }

    /** Drops the lock of a removed job. */
    void forget(long jobId) {
        locks.remove(jobId);
    }
}
