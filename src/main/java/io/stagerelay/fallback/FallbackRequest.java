package io.stagerelay.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.graph.TaskSpec;
import io.stagerelay.util.Hashing;
import io.stagerelay.util.Jsons;

import java.util.Map;
import java.util.TreeMap;

public record FallbackRequest(
        TaskSpec task,
        Map<String, JsonNode> upstream,
        Map<String, String> params,
        String reason
) {
    public FallbackRequest {
        upstream = upstream == null ? Map.of() : upstream;
        params = params == null ? Map.of() : params;
    }

    /**
     * Stable fingerprint of task identity, upstream outputs and run params.
     */
    public String digest() {
        StringBuilder sb = new StringBuilder();
        sb.append(task.id()).append('|').append(task.kind()).append('|');
        for (String dep : task.dependsOn()) {
            JsonNode node = upstream.get(dep);
            sb.append(dep).append('=').append(node == null ? "null" : Jsons.canonical(node)).append('|');
        }
        new TreeMap<>(params).forEach((k, v) -> sb.append(k).append('=').append(v).append('|'));
        return Hashing.sha256Hex(sb.toString());
    }
}
