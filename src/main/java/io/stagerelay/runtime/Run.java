package io.stagerelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.graph.TaskGraph;
import io.stagerelay.graph.TaskSpec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable state of one execution of a task graph. Results are written exactly
 * once per task id; state changes follow {@link TaskState#canTransitionTo}.
 */
public final class Run {
    private final String runId;
    private final String traceId;
    private final TaskGraph graph;
    private final Map<String, String> params;
    private final ConcurrentHashMap<String, StageResult> results;
    private final ConcurrentHashMap<String, TaskState> states;
    private final Set<Future<?>> inFlight;
    private final AtomicReference<RunStatus> status;
    private final AtomicReference<String> abortReason;

    public Run(String runId, String traceId, TaskGraph graph, Map<String, String> params) {
        this.runId = runId;
        this.traceId = traceId;
        this.graph = graph;
        this.params = Map.copyOf(params == null ? Map.of() : params);
        this.results = new ConcurrentHashMap<>();
        this.states = new ConcurrentHashMap<>();
        this.inFlight = ConcurrentHashMap.newKeySet();
        this.status = new AtomicReference<>(RunStatus.ACTIVE);
        this.abortReason = new AtomicReference<>();
        for (TaskSpec task : graph.order()) {
            states.put(task.id(), TaskState.PENDING);
        }
    }

    public String runId() {
        return runId;
    }

    public String traceId() {
        return traceId;
    }

    public TaskGraph graph() {
        return graph;
    }

    public Map<String, String> params() {
        return params;
    }

    public TaskState state(String taskId) {
        TaskState state = states.get(taskId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return state;
    }

    public void transition(String taskId, TaskState next) {
        states.compute(taskId, (id, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("Unknown task: " + id);
            }
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition for " + id + ": " + current + " -> " + next);
            }
            return next;
        });
    }

    public void abortTask(String taskId) {
        states.computeIfPresent(taskId, (id, current) -> current.canTransitionTo(TaskState.ABORTED) ? TaskState.ABORTED : current);
    }

    public void putResult(StageResult result) {
        StageResult previous = results.putIfAbsent(result.taskId(), result);
        if (previous != null) {
            throw new IllegalStateException("Result already written for task " + result.taskId());
        }
    }

    void restore(StageResult result) {
        putResult(result);
        states.put(result.taskId(), result.status() == StageStatus.FAILED ? TaskState.ABORTED : TaskState.RECORDED);
    }

    public Optional<StageResult> result(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    public boolean hasResult(String taskId) {
        return results.containsKey(taskId);
    }

    public Map<String, StageResult> results() {
        Map<String, StageResult> out = new LinkedHashMap<>();
        for (TaskSpec task : graph.order()) {
            StageResult r = results.get(task.id());
            if (r != null) {
                out.put(task.id(), r);
            }
        }
        return out;
    }

    public Map<String, JsonNode> upstreamOutputs(TaskSpec task) {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        for (String dep : task.dependsOn()) {
            StageResult r = results.get(dep);
            if (r != null && r.usable()) {
                out.put(dep, r.payloadNode());
            }
        }
        return out;
    }

    public void track(Future<?> call) {
        inFlight.add(call);
        if (isCancelled()) {
            call.cancel(true);
        }
    }

    public void untrack(Future<?> call) {
        inFlight.remove(call);
    }

    public void cancel(String reason) {
        abortReason.compareAndSet(null, reason == null || reason.isBlank() ? "cancelled" : reason);
        status.compareAndSet(RunStatus.ACTIVE, RunStatus.ABORTED);
        for (Future<?> call : inFlight) {
            call.cancel(true);
        }
    }

    public boolean isCancelled() {
        return abortReason.get() != null;
    }

    public String abortReason() {
        return abortReason.get();
    }

    public RunStatus status() {
        return status.get();
    }

    public boolean complete() {
        return status.compareAndSet(RunStatus.ACTIVE, RunStatus.COMPLETE);
    }
}
