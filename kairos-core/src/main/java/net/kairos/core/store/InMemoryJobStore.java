package net.kairos.core.store;

import net.kairos.core.model.ExecutionLog;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobStats;
import net.kairos.core.spi.JobStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Process-local store for embedding and tests. Pair with {@code TxRunner.direct()}. */
public final class InMemoryJobStore implements JobStore {
    private final Map<Long, Job> jobs = new ConcurrentHashMap<>();
    private final Map<Long, List<ExecutionLog>> logs = new ConcurrentHashMap<>();
    private final Map<Long, JobStats> stats = new ConcurrentHashMap<>();
    private final AtomicLong jobSeq = new AtomicLong();
    private final AtomicLong logSeq = new AtomicLong();

    @Override
    public Optional<Job> findByName(String name) {
        return jobs.values().stream().filter(j -> j.name().equals(name)).findFirst();
    }

    @Override
    public Optional<Job> findById(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<Job> listAll() {
        List<Job> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparing(Job::id));
        return all;
    }

    @Override
    public synchronized Job create(Job job) {
        if (findByName(job.name()).isPresent()) {
            throw new IllegalStateException("duplicate job name: " + job.name());
        }
        Job saved = job.withId(jobSeq.incrementAndGet());
        jobs.put(saved.id(), saved);
        return saved;
    }

    @Override
    public synchronized void save(Job job) {
        if (job.id() == null || !jobs.containsKey(job.id())) {
            throw new IllegalStateException("job not stored: " + job.id());
        }
        jobs.put(job.id(), job);
    }

    @Override
    public synchronized void updateRunState(long id, Instant lastRunAt, Instant nextRunAt, boolean disable, Instant updatedAt) {
        Job job = jobs.get(id);
        if (job == null) return;
        Job updated = job.withLastRunAt(lastRunAt);
        if (nextRunAt != null) updated = updated.withNextRunAt(nextRunAt);
        if (disable) updated = updated.withEnabled(false);
        jobs.put(id, updated.withTimestamps(job.createdAt(), updatedAt));
    }

    /** Removes the job together with its logs and stats. */
    @Override
    public synchronized void delete(long id) {
        jobs.remove(id);
        logs.remove(id);
        stats.remove(id);
    }

    @Override
    public ExecutionLog createLog(ExecutionLog log) {
        ExecutionLog saved = log.withId(logSeq.incrementAndGet());
        List<ExecutionLog> list = logs.computeIfAbsent(log.jobId(), k -> new ArrayList<>());
        synchronized (list) {
            list.add(saved);
        }
        return saved;
    }

    @Override
    public List<ExecutionLog> listLogs(long jobId) {
        List<ExecutionLog> list = logs.get(jobId);
        if (list == null) return List.of();
        List<ExecutionLog> copy;
        synchronized (list) {
            copy = new ArrayList<>(list);
        }
        copy.sort(Comparator.comparing(ExecutionLog::startedAt).thenComparing(ExecutionLog::id).reversed());
        return copy;
    }

    @Override
    public Optional<JobStats> getStats(long jobId) {
        return Optional.ofNullable(stats.get(jobId));
    }

    @Override
    public void upsertStats(JobStats s) {
        stats.put(s.jobId(), s);
    }

    @Override
    public List<JobStats> listAllStats() {
        List<JobStats> all = new ArrayList<>(stats.values());
        all.sort(Comparator.comparingLong(JobStats::jobId));
        return all;
    }
}
