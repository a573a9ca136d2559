package io.stagerelay.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

public final class TaskGraphBuilder {

    public TaskGraph build(List<TaskSpec> tasks) {
        return build(tasks, List.of());
    }

    public TaskGraph build(List<TaskSpec> tasks, List<String> sinks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new GraphException("Pipeline must contain at least one task");
        }
        Map<String, Integer> declarationIndex = new HashMap<>();
        Map<String, TaskSpec> byId = new LinkedHashMap<>();
        for (TaskSpec task : tasks) {
            if (InputBinding.PARAMS.equals(task.id())) {
                throw new GraphException("Task id is reserved: " + task.id());
            }
            if (byId.putIfAbsent(task.id(), task) != null) {
                throw new GraphException("Duplicate task id: " + task.id());
            }
            declarationIndex.put(task.id(), declarationIndex.size());
        }

        Map<String, List<String>> dependents = new HashMap<>();
        Map<String, Integer> remaining = new HashMap<>();
        for (TaskSpec task : tasks) {
            Set<String> seen = new HashSet<>();
            for (String dep : task.dependsOn()) {
                if (!byId.containsKey(dep)) {
                    throw new GraphException("Unknown dependsOn task: " + dep + " (referenced by " + task.id() + ")");
                }
                if (dep.equals(task.id())) {
                    throw new GraphException("Task depends on itself: " + task.id());
                }
                if (!seen.add(dep)) {
                    throw new GraphException("Duplicate dependency " + dep + " in task " + task.id());
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
            for (InputBinding binding : task.inputs()) {
                if (!binding.fromParams() && !seen.contains(binding.source())) {
                    throw new GraphException("Input " + binding.name() + " of task " + task.id()
                            + " reads " + binding.source() + ", which is not one of its dependencies");
                }
            }
            remaining.put(task.id(), task.dependsOn().size());
        }

        PriorityQueue<String> ready = new PriorityQueue<>((a, b) ->
                Integer.compare(declarationIndex.get(a), declarationIndex.get(b)));
        for (TaskSpec task : tasks) {
            if (task.dependsOn().isEmpty()) {
                ready.add(task.id());
            }
        }
        List<TaskSpec> order = new ArrayList<>(tasks.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(byId.get(id));
            for (String dependent : dependents.getOrDefault(id, List.of())) {
                int left = remaining.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != tasks.size()) {
            List<String> stuck = new ArrayList<>();
            for (TaskSpec task : tasks) {
                if (remaining.get(task.id()) > 0) {
                    stuck.add(task.id());
                }
            }
            throw new GraphException("Pipeline contains a cycle through: " + String.join(", ", stuck));
        }

        List<String> resolvedSinks = new ArrayList<>();
        if (sinks == null || sinks.isEmpty()) {
            for (TaskSpec task : order) {
                if (!dependents.containsKey(task.id())) {
                    resolvedSinks.add(task.id());
                }
            }
        } else {
            Set<String> requested = new HashSet<>();
            for (String sink : sinks) {
                if (!byId.containsKey(sink)) {
                    throw new GraphException("Unknown sink task: " + sink);
                }
                if (!requested.add(sink)) {
                    throw new GraphException("Duplicate sink task: " + sink);
                }
            }
            for (TaskSpec task : order) {
                if (requested.contains(task.id())) {
                    resolvedSinks.add(task.id());
                }
            }
        }

        Map<String, List<String>> frozenDependents = new HashMap<>();
        dependents.forEach((k, v) -> frozenDependents.put(k, List.copyOf(v)));
        return new TaskGraph(order, byId, frozenDependents, resolvedSinks);
    }
}
