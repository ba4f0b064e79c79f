package net.kairos.core.store;

import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobStats;
import net.kairos.core.model.RecurrenceKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    final InMemoryJobStore store = new InMemoryJobStore();
    final Instant t0 = Instant.parse("2030-01-01T00:00:00Z");

    private static Job job(String name) {
        return Job.ofNew(name, RecurrenceKind.CRON, "* * * * *", ExecutionKind.SHELL, "true");
    }

    @Test
    void create_assigns_ids_and_rejects_duplicate_names() {
        Job a = store.create(job("a"));
        Job b = store.create(job("b"));

        assertNotEquals(a.id(), b.id());
        assertThrows(IllegalStateException.class, () -> store.create(job("a")));
        assertEquals(List.of("a", "b"), store.listAll().stream().map(Job::name).toList());
    }

    @Test
    void logs_are_listed_most_recent_first() {
        Job a = store.create(job("a"));
        store.createLog(ExecutionLog.started(a.id(), t0).finish(t0, "1", null, 0));
        store.createLog(ExecutionLog.started(a.id(), t0.plusSeconds(60)).finish(t0.plusSeconds(61), "2", null, 0));

        List<ExecutionLog> logs = store.listLogs(a.id());

        assertEquals("2", logs.get(0).output());
        assertEquals("1", logs.get(1).output());
        assertTrue(store.listLogs(999L).isEmpty());
    }

    @Test
    void run_state_update_keeps_definition() {
        Job a = store.create(job("a").withDescription("keep me"));

        store.updateRunState(a.id(), t0, t0.plusSeconds(60), false, t0);
        Job after = store.findById(a.id()).orElseThrow();
        assertEquals(t0, after.lastRunAt());
        assertEquals(t0.plusSeconds(60), after.nextRunAt());
        assertTrue(after.enabled());
        assertEquals("keep me", after.description());

        store.updateRunState(a.id(), t0.plusSeconds(60), null, true, t0);
        after = store.findById(a.id()).orElseThrow();
        assertFalse(after.enabled());
        assertEquals(t0.plusSeconds(60), after.nextRunAt());
    }

    @Test
    void delete_drops_logs_and_stats() {
        Job a = store.create(job("a"));
        store.createLog(ExecutionLog.started(a.id(), t0).finish(t0, "x", null, 0));
        store.upsertStats(JobStats.empty(a.id()));

        store.delete(a.id());

        assertTrue(store.findById(a.id()).isEmpty());
        assertTrue(store.listLogs(a.id()).isEmpty());
        assertTrue(store.listAllStats().isEmpty());
    }
}
