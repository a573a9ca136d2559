package io.stagerelay.capability;

import com.fasterxml.jackson.databind.JsonNode;

public record CapabilityRequest(
        String runId,
        String taskId,
        String kind,
        int attempt,
        long timeoutMs,
        String traceId,
        JsonNode input
) {
}
