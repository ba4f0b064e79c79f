package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.model.Job;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.*;

public final class JdbcJobRepository {

    public Optional<Job> findById(long id) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE ID = ?
            """)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    public Optional<Job> findByName(String name) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_JOB
                WHERE NAME = ?
            """)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    public List<Job> findAll() throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("SELECT * FROM TB_JOB ORDER BY ID");
             ResultSet rs = ps.executeQuery()) {
            List<Job> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toJob(rs));
            return out;
        }
    }

    public Job insert(Job job) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_JOB(NAME, DESCRIPTION, RECURRENCE_KIND, SCHEDULE_EXPR, EXEC_KIND, COMMAND_TEXT,
                                   HTTP_METHOD, HTTP_HEADERS, HTTP_BODY, ENABLED, LAST_RUN_AT, NEXT_RUN_AT,
                                   TIMEOUT_SEC, RETRY_TIMES, RETRY_DELAY_SEC,
                                   CALLBACK_URL, CALLBACK_METHOD, CALLBACK_HEADERS, CALLBACK_BODY,
                                   CREATED_AT, UPDATED_AT)
                VALUES (?,?,?,?,?,?, ?,?,?,?,?,?, ?,?,?, ?,?,?,?, ?,?)
            """, new String[]{"ID"})) {
            Instant now = Instant.now();
            int i = bindDefinition(ps, job);
            ps.setTimestamp(i++, ts(job.createdAt() == null ? now : job.createdAt()));
            ps.setTimestamp(i, ts(job.updatedAt() == null ? now : job.updatedAt()));
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new SQLException("no key generated for job " + job.name());
                long id = k.getLong(1);
                return findById(id).orElseThrow(() -> new IllegalStateException("inserted job vanished: " + id));
            }
        }
    }

    public void update(Job job) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                UPDATE TB_JOB
                   SET NAME = ?, DESCRIPTION = ?, RECURRENCE_KIND = ?, SCHEDULE_EXPR = ?, EXEC_KIND = ?,
                       COMMAND_TEXT = ?, HTTP_METHOD = ?, HTTP_HEADERS = ?, HTTP_BODY = ?, ENABLED = ?,
                       LAST_RUN_AT = ?, NEXT_RUN_AT = ?, TIMEOUT_SEC = ?, RETRY_TIMES = ?, RETRY_DELAY_SEC = ?,
                       CALLBACK_URL = ?, CALLBACK_METHOD = ?, CALLBACK_HEADERS = ?, CALLBACK_BODY = ?,
                       UPDATED_AT = ?
                 WHERE ID = ?
            """)) {
            int i = bindDefinition(ps, job);
            ps.setTimestamp(i++, ts(job.updatedAt() == null ? Instant.now() : job.updatedAt()));
            ps.setLong(i, job.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_JOB not found for ID=" + job.id());
            }
        }
    }

    /** Only the columns a firing owns; NEXT_RUN_AT is kept when {@code nextRunAt} is null. */
    public void updateRunState(long id, Instant lastRunAt, Instant nextRunAt, boolean disable, Instant updatedAt) throws SQLException {
        StringBuilder sql = new StringBuilder("UPDATE TB_JOB SET LAST_RUN_AT = ?, UPDATED_AT = ?");
        if (nextRunAt != null) sql.append(", NEXT_RUN_AT = ?");
        if (disable) sql.append(", ENABLED = 'N'");
        sql.append(" WHERE ID = ?");
        try (PreparedStatement ps = TxContext.require().prepareStatement(sql.toString())) {
            int i = 1;
            ps.setTimestamp(i++, ts(lastRunAt));
            ps.setTimestamp(i++, ts(updatedAt));
            if (nextRunAt != null) ps.setTimestamp(i++, ts(nextRunAt));
            ps.setLong(i, id);
            ps.executeUpdate();
        }
    }

    public void delete(long id) throws SQLException {
        try (PreparedStatement ps = TxContext.require().prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
    }

    private static int bindDefinition(PreparedStatement ps, Job job) throws SQLException {
        int i = 1;
        ps.setString(i++, job.name());
        ps.setString(i++, job.description());
        ps.setString(i++, job.recurrence().code());
        ps.setString(i++, job.schedule());
        ps.setString(i++, job.execution().code());
        ps.setString(i++, job.command());
        ps.setString(i++, job.httpMethod());
        ps.setString(i++, headersToJson(job.httpHeaders()));
        ps.setString(i++, job.httpBody());
        ps.setString(i++, yn(job.enabled()));
        ps.setTimestamp(i++, ts(job.lastRunAt()));
        ps.setTimestamp(i++, ts(job.nextRunAt()));
        ps.setInt(i++, job.timeoutSeconds());
        ps.setInt(i++, job.retryTimes());
        ps.setInt(i++, job.retryDelaySeconds());
        ps.setString(i++, job.callbackUrl());
        ps.setString(i++, job.callbackMethod());
        ps.setString(i++, headersToJson(job.callbackHeaders()));
        ps.setString(i++, job.callbackBodyTemplate());
        return i;
    }
}
