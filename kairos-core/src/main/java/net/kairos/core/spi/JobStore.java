package net.kairos.core.spi;

import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobStats;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Source of truth for jobs, execution logs and stats.
 * Implementations may require an active {@link TxRunner} transaction.
 */
public interface JobStore {
    Optional<Job> findByName(String name) throws Exception;
    Optional<Job> findById(long id) throws Exception;
    List<Job> listAll() throws Exception;

    /** Inserts a new job and returns it with its generated id. */
    Job create(Job job) throws Exception;
    void save(Job job) throws Exception;
    void delete(long id) throws Exception;

    /**
     * Records the outcome of a firing on the job row without touching its definition.
     *
     * @param nextRunAt new next run, or null to keep the stored value
     * @param disable   whether to switch the job off
     */
    void updateRunState(long id, Instant lastRunAt, Instant nextRunAt, boolean disable, Instant updatedAt) throws Exception;

    ExecutionLog createLog(ExecutionLog log) throws Exception;
    /** Most recent first. */
    List<ExecutionLog> listLogs(long jobId) throws Exception;

    Optional<JobStats> getStats(long jobId) throws Exception;
    void upsertStats(JobStats stats) throws Exception;  // insert when absent, else update
    List<JobStats> listAllStats() throws Exception;
}
