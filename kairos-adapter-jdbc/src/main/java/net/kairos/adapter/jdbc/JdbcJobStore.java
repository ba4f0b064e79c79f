package net.kairos.adapter.jdbc;

import net.kairos.adapter.jdbc.repo.JdbcExecutionLogRepository;
import net.kairos.adapter.jdbc.repo.JdbcJobRepository;
import net.kairos.adapter.jdbc.repo.JdbcJobStatsRepository;
import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobStats;
import net.kairos.core.spi.JobStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link JobStore} over {@code TB_JOB}, {@code TB_EXECUTION_LOG} and {@code TB_JOB_STATS}.
 * Every call must run inside a {@link JdbcTxRunner} (or Spring) transaction.
 */
public final class JdbcJobStore implements JobStore {
    private final JdbcJobRepository jobs = new JdbcJobRepository();
    private final JdbcExecutionLogRepository logs = new JdbcExecutionLogRepository();
    private final JdbcJobStatsRepository stats = new JdbcJobStatsRepository();

    @Override public Optional<Job> findByName(String name) throws Exception { return jobs.findByName(name); }
    @Override public Optional<Job> findById(long id) throws Exception { return jobs.findById(id); }
    @Override public List<Job> listAll() throws Exception { return jobs.findAll(); }

    @Override
    public Job create(Job job) throws Exception {
        if (jobs.findByName(job.name()).isPresent()) {
            throw new IllegalStateException("duplicate job name: " + job.name());
        }
        return jobs.insert(job);
    }

    @Override public void save(Job job) throws Exception { jobs.update(job); }

    @Override
    public void updateRunState(long id, Instant lastRunAt, Instant nextRunAt, boolean disable, Instant updatedAt) throws Exception {
        jobs.updateRunState(id, lastRunAt, nextRunAt, disable, updatedAt);
    }

    /** Logs and stats go with the job (ON DELETE CASCADE). */
    @Override public void delete(long id) throws Exception { jobs.delete(id); }

    @Override public ExecutionLog createLog(ExecutionLog log) throws Exception { return logs.insert(log); }
    @Override public List<ExecutionLog> listLogs(long jobId) throws Exception { return logs.findByJob(jobId); }

    @Override public Optional<JobStats> getStats(long jobId) throws Exception { return stats.findByJob(jobId); }
    @Override public void upsertStats(JobStats s) throws Exception { stats.upsert(s); }
    @Override public List<JobStats> listAllStats() throws Exception { return stats.findAll(); }
}
