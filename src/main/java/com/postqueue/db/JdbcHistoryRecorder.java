package com.postqueue.db;

import com.postqueue.core.ExecutionRecord;
import com.postqueue.core.PersistenceException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-backed history over the {@code execution_history} table. Rows are
 * inserted, never updated.
 */
public class JdbcHistoryRecorder implements HistoryRecorder {

    private final Database database;

    public JdbcHistoryRecorder(Database database) {
        this.database = database;
    }

    @Override
    public void append(ExecutionRecord record) throws PersistenceException {
        String sql = "INSERT INTO execution_history (id, job_id, target, executed_at, success, error_message, receipt_id) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, record.getId());
            stmt.setString(2, record.getJobId());
            stmt.setString(3, record.getTarget());
            stmt.setObject(4, JdbcJobStore.toOffset(record.getExecutedAt()));
            stmt.setBoolean(5, record.isSuccess());
            stmt.setString(6, record.getErrorMessage());
            stmt.setString(7, record.getReceiptId());

            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to append execution record for job " + record.getJobId(), e);
        }
    }

    @Override
    public List<ExecutionRecord> recent(String target, int limit) throws PersistenceException {
        if (target == null) {
            return query("SELECT * FROM execution_history ORDER BY executed_at DESC LIMIT ?", limit);
        }
        return query("SELECT * FROM execution_history WHERE target = ? ORDER BY executed_at DESC LIMIT ?", target, limit);
    }

    @Override
    public List<ExecutionRecord> forJob(String jobId, int limit) throws PersistenceException {
        return query("SELECT * FROM execution_history WHERE job_id = ? ORDER BY executed_at DESC LIMIT ?", jobId, limit);
    }

    @Override
    public List<ExecutionRecord> failuresSince(Instant since) throws PersistenceException {
        return query("SELECT * FROM execution_history WHERE success = FALSE AND executed_at >= ? "
            + "ORDER BY executed_at DESC", JdbcJobStore.toOffset(since));
    }

    private List<ExecutionRecord> query(String sql, Object... params) throws PersistenceException {
        List<ExecutionRecord> records = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(mapResultSetToRecord(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to query execution history", e);
        }
        return records;
    }

    private ExecutionRecord mapResultSetToRecord(ResultSet rs) throws SQLException {
        return new ExecutionRecord(
            rs.getString("id"),
            rs.getString("job_id"),
            rs.getString("target"),
            JdbcJobStore.toInstant(rs.getObject("executed_at", OffsetDateTime.class)),
            rs.getBoolean("success"),
            rs.getString("error_message"),
            rs.getString("receipt_id"));
    }
}
