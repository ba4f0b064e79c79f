package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.JobStats;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.ts;

public final class JdbcJobStatsRepository {

    public Optional<JobStats> findByJob(long jobId) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_JOB_STATS WHERE JOB_ID = ?")) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJobStats(rs));
            }
        }
    }

    public List<JobStats> findAll() throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_JOB_STATS ORDER BY JOB_ID");
             ResultSet rs = ps.executeQuery()) {
            List<JobStats> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJobStats(rs));
            return out;
        }
    }

    /** UPDATE first, INSERT when no row was there. Callers serialize per job. */
    public void upsert(JobStats s) throws SQLException {
        Connection c = TxContext.require();
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE TB_JOB_STATS
                   SET TOTAL_RUNS = ?, SUCCESS_RUNS = ?, FAILED_RUNS = ?, TIMEOUT_RUNS = ?,
                       TOTAL_DURATION_SEC = ?, AVG_DURATION_SEC = ?, RETRY_COUNT = ?,
                       LAST_SUCCESS_AT = ?, LAST_FAILURE_AT = ?, LAST_ERROR = ?, UPDATED_AT = ?
                 WHERE JOB_ID = ?
            """)) {
            int i = bind(ps, s);
            ps.setLong(i, s.jobId());
            if (ps.executeUpdate() > 0) return;
        }
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_JOB_STATS(TOTAL_RUNS, SUCCESS_RUNS, FAILED_RUNS, TIMEOUT_RUNS,
                                         TOTAL_DURATION_SEC, AVG_DURATION_SEC, RETRY_COUNT,
                                         LAST_SUCCESS_AT, LAST_FAILURE_AT, LAST_ERROR, UPDATED_AT, JOB_ID)
                VALUES (?,?,?,?,?,?,?,?,?,?,?,?)
            """)) {
            int i = bind(ps, s);
            ps.setLong(i, s.jobId());
            ps.executeUpdate();
        }
    }

    private static int bind(PreparedStatement ps, JobStats s) throws SQLException {
        int i = 1;
        ps.setLong(i++, s.totalRuns());
        ps.setLong(i++, s.successRuns());
        ps.setLong(i++, s.failedRuns());
        ps.setLong(i++, s.timeoutRuns());
        ps.setLong(i++, s.totalDurationSeconds());
        ps.setDouble(i++, s.avgDurationSeconds());
        ps.setLong(i++, s.retryCount());
        ps.setTimestamp(i++, ts(s.lastSuccessAt()));
        ps.setTimestamp(i++, ts(s.lastFailureAt()));
        ps.setString(i++, s.lastError());
        ps.setTimestamp(i++, ts(s.updatedAt()));
        return i;
    }
}
