package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.ExecutionLog;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

import static net.kairos.adapter.jdbc.JdbcUtil.ts;

public final class JdbcExecutionLogRepository {

    public ExecutionLog insert(ExecutionLog log) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_EXECUTION_LOG(JOB_ID, STATUS, STARTED_AT, ENDED_AT, DURATION_SEC,
                                             OUTPUT_TEXT, ERROR_TEXT, RETRIES_CONSUMED)
                VALUES (?,?,?,?,?,?,?,?)
            """, new String[]{"ID"})) {
            int i = 1;
            ps.setLong(i++, log.jobId());
            ps.setInt(i++, log.status().code());
            ps.setTimestamp(i++, ts(log.startedAt()));
            ps.setTimestamp(i++, ts(log.endedAt()));
            ps.setLong(i++, log.durationSeconds());
            ps.setString(i++, log.output());
            ps.setString(i++, log.error());
            ps.setInt(i, log.retriesConsumed());
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new SQLException("no key generated for execution log of job " + log.jobId());
                return log.withId(k.getLong(1));
            }
        }
    }

    /** Most recent first. */
    public List<ExecutionLog> findByJob(long jobId) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_EXECUTION_LOG
                WHERE JOB_ID = ?
                ORDER BY STARTED_AT DESC, ID DESC
            """)) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                List<ExecutionLog> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toExecutionLog(rs));
                return out;
            }
        }
    }
}
