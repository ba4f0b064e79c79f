package net.kairos.core.service;

import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.JobStats;
import net.kairos.core.spi.TxRunner;
import net.kairos.core.store.InMemoryJobStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class StatsAggregatorTest {

    final InMemoryJobStore store = new InMemoryJobStore();
    final Instant t0 = Instant.parse("2030-05-01T00:00:00Z");
    final StatsAggregator stats = new StatsAggregator(store, TxRunner.direct(), () -> t0);

    private ExecutionLog run(long seconds, String error, int retries) {
        return ExecutionLog.started(1L, t0).finish(t0.plusSeconds(seconds), "out", error, retries);
    }

    @Test
    void first_run_creates_row() throws Exception {
        assertTrue(store.getStats(1L).isEmpty());

        stats.update(1L, run(4, null, 0), false);

        JobStats s = store.getStats(1L).orElseThrow();
        assertEquals(1, s.totalRuns());
        assertEquals(1, s.successRuns());
        assertEquals(0, s.failedRuns());
        assertEquals(4, s.totalDurationSeconds());
        assertEquals(4.0, s.avgDurationSeconds());
        assertEquals(t0.plusSeconds(4), s.lastSuccessAt());
        assertNull(s.lastFailureAt());
        assertEquals(t0, s.updatedAt());
    }

    @Test
    void mixed_runs_keep_average_and_counters_consistent() throws Exception {
        stats.update(1L, run(1, null, 0), false);
        stats.update(1L, run(2, "command exited with code 1", 3), false);
        stats.update(1L, run(6, "execution timed out (5 seconds)", 1), true);

        JobStats s = store.getStats(1L).orElseThrow();
        assertEquals(3, s.totalRuns());
        assertEquals(1, s.successRuns());
        assertEquals(2, s.failedRuns());
        assertEquals(1, s.timeoutRuns());
        assertEquals(9, s.totalDurationSeconds());
        assertEquals(3.0, s.avgDurationSeconds(), 1e-9);
        assertEquals((double) s.totalDurationSeconds() / s.totalRuns(), s.avgDurationSeconds(), 1e-9);
        assertEquals(4, s.retryCount());
        assertEquals("execution timed out (5 seconds)", s.lastError());
    }

    @Test
    void concurrent_updates_of_one_job_are_not_lost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> stats.update(1L, run(1, null, 1), false)));
            }
            for (Future<?> f : futures) f.get();
        } finally {
            pool.shutdownNow();
        }

        JobStats s = store.getStats(1L).orElseThrow();
        assertEquals(200, s.totalRuns());
        assertEquals(200, s.retryCount());
        assertEquals(1.0, s.avgDurationSeconds(), 1e-9);
    }
}
