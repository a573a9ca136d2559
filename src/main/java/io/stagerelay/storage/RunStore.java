package io.stagerelay.storage;

import io.stagerelay.runtime.StageResult;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class RunStore {
    private final Database database;

    public RunStore(Database database) {
        this.database = database;
    }

    public void insertRun(RunRow row) {
        String sql = """
                INSERT INTO runs(run_id,pipeline_name,status,trace_id,definition_json,params_json,sinks_json,
                                 output_digest,last_error,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, row.runId());
            ps.setString(2, row.pipelineName());
            ps.setString(3, row.status());
            ps.setString(4, row.traceId());
            ps.setString(5, row.definitionJson());
            ps.setString(6, row.paramsJson());
            ps.setString(7, row.sinksJson());
            ps.setString(8, row.outputDigest());
            ps.setString(9, row.lastError());
            ps.setLong(10, row.createdAtMs());
            ps.setLong(11, row.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (findRun(row.runId()).isPresent()) {
                throw new IllegalArgumentException("Run id already exists: " + row.runId(), e);
            }
            throw new RuntimeException("Failed to insert run " + row.runId(), e);
        }
    }

    public Optional<RunRow> findRun(String runId) {
        String sql = """
                SELECT run_id,pipeline_name,status,trace_id,definition_json,params_json,sinks_json,
                       output_digest,last_error,created_at_ms,updated_at_ms
                FROM runs WHERE run_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readRun(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read run " + runId, e);
        }
    }

    public List<RunRow> listRuns(String status, int limit) {
        String base = """
                SELECT run_id,pipeline_name,status,trace_id,definition_json,params_json,sinks_json,
                       output_digest,last_error,created_at_ms,updated_at_ms
                FROM runs
                """;
        boolean withStatus = status != null && !status.isBlank();
        String sql = base + (withStatus ? " WHERE status=?" : "") + " ORDER BY created_at_ms DESC, run_id LIMIT ?";
        List<RunRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (withStatus) {
                ps.setString(i++, status.trim().toUpperCase());
            }
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list runs", e);
        }
    }

    public void finishRun(String runId, String status, String outputDigest, String lastError, long nowMs) {
        String sql = "UPDATE runs SET status=?, output_digest=?, last_error=?, updated_at_ms=? WHERE run_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status);
            ps.setString(2, outputDigest);
            ps.setString(3, lastError);
            ps.setLong(4, nowMs);
            ps.setString(5, runId);
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("Run not found: " + runId);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update run " + runId, e);
        }
    }

    public void markActive(String runId, long nowMs) {
        String sql = "UPDATE runs SET status='ACTIVE', last_error=NULL, updated_at_ms=? WHERE run_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, runId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reactivate run " + runId, e);
        }
    }

    /**
     * Appends the final result of one task. The sequence number is assigned in
     * the same transaction; a second record for the same task is refused.
     */
    public RunLogRecord appendRecord(String runId, StageResult result, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                if (isRecorded(c, runId, result.taskId())) {
                    throw new IllegalStateException("Task already recorded: run=" + runId + " task=" + result.taskId());
                }
                long seq = nextSeq(c, runId);
                RunLogRecord record = RunLogRecord.of(runId, seq, result);
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO run_log(run_id,seq,task_id,status,record_json,recorded_at_ms) VALUES(?,?,?,?,?,?)")) {
                    ps.setString(1, runId);
                    ps.setLong(2, seq);
                    ps.setString(3, result.taskId());
                    ps.setString(4, result.status().name());
                    ps.setString(5, record.toJson());
                    ps.setLong(6, nowMs);
                    ps.executeUpdate();
                }
                c.commit();
                return record;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append run log record: run=" + runId + " task=" + result.taskId(), e);
        }
    }

    public List<RunLogRecord> listRecords(String runId) {
        String sql = "SELECT record_json FROM run_log WHERE run_id=? ORDER BY seq";
        List<RunLogRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(RunLogRecord.fromJson(rs.getString("record_json")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read run log for " + runId, e);
        }
    }

    private boolean isRecorded(Connection c, String runId, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM run_log WHERE run_id=? AND task_id=? LIMIT 1")) {
            ps.setString(1, runId);
            ps.setString(2, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private long nextSeq(Connection c, String runId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COALESCE(MAX(seq),0)+1 FROM run_log WHERE run_id=?")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    private RunRow readRun(ResultSet rs) throws SQLException {
        return new RunRow(
                rs.getString("run_id"),
                rs.getString("pipeline_name"),
                rs.getString("status"),
                rs.getString("trace_id"),
                rs.getString("definition_json"),
                rs.getString("params_json"),
                rs.getString("sinks_json"),
                rs.getString("output_digest"),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }
}
