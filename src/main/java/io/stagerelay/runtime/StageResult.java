package io.stagerelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.util.Jsons;

/**
 * Final outcome of one task. {@code payload} is canonical JSON (keys sorted) so
 * that a result read back from the run log renders byte-for-byte the same; it is
 * null only for {@link StageStatus#FAILED}.
 */
public record StageResult(
        String taskId,
        StageStatus status,
        Provenance provenance,
        String payload,
        int attempts,
        String lastError,
        long startedAtMs,
        long finishedAtMs
) {
    public static StageResult success(String taskId, JsonNode payload, int attempts, long startedAtMs, long finishedAtMs) {
        return new StageResult(taskId, StageStatus.SUCCESS, Provenance.CAPABILITY, Jsons.canonical(payload),
                attempts, null, startedAtMs, finishedAtMs);
    }

    public static StageResult fallback(String taskId, JsonNode payload, int attempts, String lastError,
                                       long startedAtMs, long finishedAtMs) {
        return new StageResult(taskId, StageStatus.FALLBACK_USED, Provenance.FALLBACK, Jsons.canonical(payload),
                attempts, lastError, startedAtMs, finishedAtMs);
    }

    public static StageResult failed(String taskId, int attempts, String lastError, long startedAtMs, long finishedAtMs) {
        return new StageResult(taskId, StageStatus.FAILED, Provenance.FALLBACK, null,
                attempts, lastError, startedAtMs, finishedAtMs);
    }

    public boolean usable() {
        return status != StageStatus.FAILED && payload != null;
    }

    public JsonNode payloadNode() {
        return payload == null ? Jsons.mapper().nullNode() : Jsons.readTree(payload);
    }
}
