package net.kairos.adapter.jdbc.mapper;

import net.kairos.adapter.jdbc.JdbcUtil;
import net.kairos.core.model.*;

import java.sql.*;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAME"),
                RecurrenceKind.from(rs.getString("RECURRENCE_KIND")),
                rs.getString("SCHEDULE_EXPR"),
                ExecutionKind.from(rs.getString("EXEC_KIND")),
                rs.getString("COMMAND_TEXT"),
                rs.getString("HTTP_METHOD"),
                JdbcUtil.headersFromJson(rs.getString("HTTP_HEADERS")),
                rs.getString("HTTP_BODY"),
                JdbcUtil.isY(rs.getString("ENABLED")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_RUN_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN_AT")),
                rs.getInt("TIMEOUT_SEC"),
                rs.getInt("RETRY_TIMES"),
                rs.getInt("RETRY_DELAY_SEC"),
                rs.getString("DESCRIPTION"),
                rs.getString("CALLBACK_URL"),
                rs.getString("CALLBACK_METHOD"),
                JdbcUtil.headersFromJson(rs.getString("CALLBACK_HEADERS")),
                rs.getString("CALLBACK_BODY"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- ExecutionLog ---
    public static ExecutionLog toExecutionLog(ResultSet rs) throws SQLException {
        return new ExecutionLog(
                rs.getLong("ID"),
                rs.getLong("JOB_ID"),
                ExecutionLog.Status.fromCode(rs.getInt("STATUS")),
                rs.getTimestamp("STARTED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("ENDED_AT")),
                rs.getLong("DURATION_SEC"),
                rs.getString("OUTPUT_TEXT"),
                rs.getString("ERROR_TEXT"),
                rs.getInt("RETRIES_CONSUMED")
        );
    }

    // --- JobStats ---
    public static JobStats toJobStats(ResultSet rs) throws SQLException {
        return new JobStats(
                rs.getLong("JOB_ID"),
                rs.getLong("TOTAL_RUNS"),
                rs.getLong("SUCCESS_RUNS"),
                rs.getLong("FAILED_RUNS"),
                rs.getLong("TIMEOUT_RUNS"),
                rs.getLong("TOTAL_DURATION_SEC"),
                rs.getDouble("AVG_DURATION_SEC"),
                rs.getLong("RETRY_COUNT"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_SUCCESS_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_FAILURE_AT")),
                rs.getString("LAST_ERROR"),
                JdbcUtil.toInstant(rs.getTimestamp("UPDATED_AT"))
        );
    }
}
