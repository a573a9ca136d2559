package io.stagerelay.pipeline;

import io.stagerelay.validation.OutputPolicy;

import java.util.List;
import java.util.Map;

public record TaskDescriptor(
        String id,
        String kind,
        List<String> dependsOn,
        Map<String, String> inputs,
        Long timeoutMs,
        Integer maxAttempts,
        String fallback,
        Map<String, String> metadata,
        String outputFile,
        OutputPolicy output
) {
    public TaskDescriptor {
        if (dependsOn == null) dependsOn = List.of();
        if (inputs == null) inputs = Map.of();
        if (metadata == null) metadata = Map.of();
    }
}
