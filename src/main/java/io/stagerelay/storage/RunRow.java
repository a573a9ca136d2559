package io.stagerelay.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RunRow(
        String runId,
        String pipelineName,
        String status,
        String traceId,
        String definitionJson,
        String paramsJson,
        String sinksJson,
        String outputDigest,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
    public Map<String, String> params() {
        try {
            return Jsons.mapper().readValue(paramsJson, new TypeReference<LinkedHashMap<String, String>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt params for run " + runId, e);
        }
    }

    public List<String> sinks() {
        try {
            return Jsons.mapper().readValue(sinksJson, new TypeReference<List<String>>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt sinks for run " + runId, e);
        }
    }
}
