package io.stagerelay.graph;

import io.stagerelay.validation.OutputPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public record TaskSpec(
        String id,
        String kind,
        List<String> dependsOn,
        List<InputBinding> inputs,
        OutputPolicy output,
        long timeoutMs,
        int maxAttempts,
        String fallback,
        Map<String, String> metadata,
        String outputFile
) {
    public TaskSpec {
        if (id == null || id.isBlank()) {
            throw new GraphException("task id cannot be empty");
        }
        if (kind == null || kind.isBlank()) {
            throw new GraphException("task kind cannot be empty: " + id);
        }
        if (timeoutMs <= 0) {
            throw new GraphException("task timeout must be positive: " + id);
        }
        if (maxAttempts < 1) {
            throw new GraphException("task maxAttempts must be >= 1: " + id);
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (inputs == null || inputs.isEmpty()) {
            List<InputBinding> defaults = new ArrayList<>();
            for (String dep : dependsOn) {
                defaults.add(new InputBinding(dep, dep, ""));
            }
            inputs = defaults;
        }
        inputs = List.copyOf(inputs);
        output = output == null ? new OutputPolicy(List.of(), List.of(), true) : output;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TaskSpec of(String id, String kind, List<String> dependsOn, OutputPolicy output,
                              long timeoutMs, int maxAttempts) {
        return new TaskSpec(id, kind, dependsOn, List.of(), output, timeoutMs, maxAttempts, null, Map.of(), null);
    }
}
