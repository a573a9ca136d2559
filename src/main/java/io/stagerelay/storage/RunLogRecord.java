package io.stagerelay.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.runtime.Provenance;
import io.stagerelay.runtime.StageResult;
import io.stagerelay.runtime.StageStatus;
import io.stagerelay.util.Jsons;

import java.io.IOException;

public record RunLogRecord(
        @JsonProperty("schema") String schema,
        @JsonProperty("run_id") String runId,
        @JsonProperty("seq") long seq,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") StageStatus status,
        @JsonProperty("provenance") Provenance provenance,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("error") String error,
        @JsonProperty("started_at_ms") long startedAtMs,
        @JsonProperty("finished_at_ms") long finishedAtMs
) {
    public static final String SCHEMA = "stagerelay.runlog.v1";

    public static RunLogRecord of(String runId, long seq, StageResult result) {
        return new RunLogRecord(
                SCHEMA,
                runId,
                seq,
                result.taskId(),
                result.status(),
                result.provenance(),
                result.payload() == null ? null : Jsons.readTree(result.payload()),
                result.attempts(),
                result.lastError(),
                result.startedAtMs(),
                result.finishedAtMs()
        );
    }

    public StageResult toStageResult() {
        String canonical = payload == null || payload.isNull() ? null : Jsons.canonical(payload);
        return new StageResult(taskId, status, provenance, canonical, attempts, error, startedAtMs, finishedAtMs);
    }

    public String toJson() {
        return Jsons.toCompactJson(this);
    }

    public static RunLogRecord fromJson(String json) {
        try {
            return Jsons.mapper().readValue(json, RunLogRecord.class);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable run log record: " + e.getMessage(), e);
        }
    }
}
