package io.stagerelay.pipeline;

import io.stagerelay.config.PipelineSettings;
import io.stagerelay.graph.InputBinding;
import io.stagerelay.graph.TaskGraph;
import io.stagerelay.graph.TaskGraphBuilder;
import io.stagerelay.graph.TaskSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PipelineDefinition(
        String name,
        Map<String, String> params,
        List<String> sinks,
        List<TaskDescriptor> tasks
) {
    public PipelineDefinition {
        if (name == null || name.isBlank()) name = "pipeline";
        params = params == null ? Map.of() : new LinkedHashMap<>(params);
        sinks = sinks == null ? List.of() : List.copyOf(sinks);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public List<TaskSpec> toTaskSpecs(PipelineSettings settings) {
        List<TaskSpec> out = new ArrayList<>(tasks.size());
        for (TaskDescriptor d : tasks) {
            List<InputBinding> bindings = new ArrayList<>();
            d.inputs().forEach((name, expression) -> bindings.add(InputBinding.parse(name, expression)));
            out.add(new TaskSpec(
                    d.id(),
                    d.kind(),
                    d.dependsOn(),
                    bindings,
                    d.output(),
                    d.timeoutMs() == null ? settings.defaultTimeoutMs() : d.timeoutMs(),
                    d.maxAttempts() == null ? settings.defaultMaxAttempts() : d.maxAttempts(),
                    d.fallback(),
                    d.metadata(),
                    d.outputFile()
            ));
        }
        return out;
    }

    public TaskGraph toGraph(PipelineSettings settings) {
        return new TaskGraphBuilder().build(toTaskSpecs(settings), sinks);
    }

    public Map<String, String> resolveParams(Map<String, String> overrides) {
        Map<String, String> out = new LinkedHashMap<>(params);
        if (overrides != null) {
            out.putAll(overrides);
        }
        return out;
    }
}
