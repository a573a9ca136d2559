package io.stagerelay.graph;

import java.util.List;
import java.util.Map;

public final class TaskGraph {
    private final List<TaskSpec> order;
    private final Map<String, TaskSpec> byId;
    private final Map<String, List<String>> dependents;
    private final List<String> sinks;

    TaskGraph(List<TaskSpec> order, Map<String, TaskSpec> byId, Map<String, List<String>> dependents, List<String> sinks) {
        this.order = List.copyOf(order);
        this.byId = Map.copyOf(byId);
        this.dependents = Map.copyOf(dependents);
        this.sinks = List.copyOf(sinks);
    }

    public List<TaskSpec> order() {
        return order;
    }

    public List<String> orderIds() {
        return order.stream().map(TaskSpec::id).toList();
    }

    public TaskSpec task(String id) {
        TaskSpec task = byId.get(id);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + id);
        }
        return task;
    }

    public List<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, List.of());
    }

    public List<String> entryPoints() {
        return order.stream().filter(t -> t.dependsOn().isEmpty()).map(TaskSpec::id).toList();
    }

    public List<String> sinks() {
        return sinks;
    }

    public int size() {
        return order.size();
    }
}
