package io.stagerelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagerelay.capability.CallError;
import io.stagerelay.capability.Capability;
import io.stagerelay.capability.CapabilityRegistry;
import io.stagerelay.capability.CapabilityRequest;
import io.stagerelay.capability.CapabilityResult;
import io.stagerelay.graph.InputBinding;
import io.stagerelay.graph.TaskSpec;
import io.stagerelay.observability.TraceContextUtil;
import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class StageExecutor {
    private final CapabilityRegistry registry;
    private final ExecutorService callPool;

    public StageExecutor(CapabilityRegistry registry, ExecutorService callPool) {
        this.registry = registry;
        this.callPool = callPool;
    }

    public StageCall runTask(TaskSpec task, Run run, int attempt) {
        Optional<Capability> capability = registry.findByKind(task.kind());
        if (capability.isEmpty()) {
            return StageCall.failed(CallError.capability("no capability registered for kind " + task.kind()));
        }
        if (run.isCancelled()) {
            return StageCall.failed(CallError.cancelled());
        }
        CapabilityRequest request = new CapabilityRequest(
                run.runId(),
                task.id(),
                task.kind(),
                attempt,
                task.timeoutMs(),
                run.traceId() + "/" + TraceContextUtil.newSpanId(),
                buildInput(task, run, attempt)
        );
        Capability target = capability.get();
        Future<CapabilityResult> call = callPool.submit(() -> target.invoke(request));
        run.track(call);
        try {
            CapabilityResult result = call.get(task.timeoutMs(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return StageCall.failed(CallError.capability("capability returned no result"));
            }
            if (!result.success()) {
                return StageCall.failed(CallError.capability(result.error()));
            }
            if (result.output() == null) {
                return StageCall.failed(CallError.capability("capability returned no output"));
            }
            return StageCall.ok(result.output());
        } catch (TimeoutException e) {
            call.cancel(true);
            return StageCall.failed(CallError.timeout(task.timeoutMs()));
        } catch (CancellationException e) {
            return StageCall.failed(CallError.cancelled());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return StageCall.failed(CallError.cancelled());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof IOException || cause instanceof UncheckedIOException) {
                return StageCall.failed(CallError.transport(String.valueOf(cause.getMessage())));
            }
            if (cause instanceof InterruptedException) {
                return StageCall.failed(CallError.cancelled());
            }
            return StageCall.failed(CallError.capability(cause.getClass().getSimpleName() + ": " + cause.getMessage()));
        } finally {
            run.untrack(call);
        }
    }

    public static ObjectNode buildInput(TaskSpec task, Run run, int attempt) {
        ObjectNode input = Jsons.mapper().createObjectNode();
        input.put("task_id", task.id());
        input.put("kind", task.kind());
        input.put("attempt", attempt);
        ObjectNode params = input.putObject("params");
        run.params().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> params.put(e.getKey(), e.getValue()));
        ObjectNode metadata = input.putObject("metadata");
        task.metadata().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> metadata.put(e.getKey(), e.getValue()));
        ObjectNode inputs = input.putObject("inputs");
        for (InputBinding binding : task.inputs()) {
            inputs.set(binding.name(), resolve(binding, run, params));
        }
        input.set("expected_output", Jsons.mapper().valueToTree(task.output()));
        return input;
    }

    private static JsonNode resolve(InputBinding binding, Run run, JsonNode params) {
        JsonNode source;
        if (binding.fromParams()) {
            source = params;
        } else {
            source = run.result(binding.source())
                    .filter(StageResult::usable)
                    .map(StageResult::payloadNode)
                    .orElse(null);
        }
        if (source == null) {
            return Jsons.mapper().nullNode();
        }
        JsonNode selected = binding.pointer().isEmpty() ? source : source.at(binding.pointer());
        return selected.isMissingNode() ? Jsons.mapper().nullNode() : selected.deepCopy();
    }

    public record StageCall(String raw, CallError error) {
        public static StageCall ok(String raw) {
            return new StageCall(raw, null);
        }

        public static StageCall failed(CallError error) {
            return new StageCall(null, error);
        }

        public boolean succeeded() {
            return error == null;
        }
    }
}
