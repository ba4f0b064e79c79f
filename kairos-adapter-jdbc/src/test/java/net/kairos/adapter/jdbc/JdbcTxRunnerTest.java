package net.kairos.adapter.jdbc;

import net.kairos.core.model.ExecutionKind;
import net.kairos.core.model.Job;
import net.kairos.core.model.RecurrenceKind;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTxRunnerTest extends TestSupport {

    final JdbcJobStore store = new JdbcJobStore();
    final Instant t0 = Instant.parse("2030-03-01T12:00:00Z");

    private Job job(String name) {
        return Job.ofNew(name, RecurrenceKind.CRON, "* * * * *", ExecutionKind.SHELL, "true").withTimestamps(t0, t0);
    }

    @Test
    void nested_required_joins_the_outer_connection() throws Exception {
        boolean same = tx.required(() -> {
            Connection outer = TxContext.require();
            return tx.required(() -> TxContext.require() == outer);
        });

        assertTrue(same);
        assertNull(TxContext.get());
    }

    @Test
    void failure_in_a_joined_body_rolls_back_the_whole_transaction() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            store.create(job("kept-out"));
            return tx.required(() -> {
                throw new IllegalStateException("boom");
            });
        }));

        assertTrue(tx.required(() -> store.findByName("kept-out")).isEmpty());
        assertNull(TxContext.get());
    }

    @Test
    void committed_work_is_visible_to_the_next_transaction() throws Exception {
        tx.required(() -> store.create(job("kept")));

        assertTrue(tx.required(() -> store.findByName("kept")).isPresent());
    }
}
