package io.stagerelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.capability.CapabilityRegistry;
import io.stagerelay.config.PipelineSettings;
import io.stagerelay.config.StageRelayConfig;
import io.stagerelay.fallback.FallbackRequest;
import io.stagerelay.fallback.FallbackSynthesisException;
import io.stagerelay.fallback.FallbackSynthesizer;
import io.stagerelay.graph.GraphException;
import io.stagerelay.graph.TaskGraph;
import io.stagerelay.graph.TaskSpec;
import io.stagerelay.observability.AuditLogger;
import io.stagerelay.observability.TraceContextUtil;
import io.stagerelay.pipeline.PipelineDefinition;
import io.stagerelay.pipeline.PipelineLoader;
import io.stagerelay.replay.RunNotFoundException;
import io.stagerelay.replay.RunRecorder;
import io.stagerelay.replay.RunReplayer;
import io.stagerelay.retry.AttemptResult;
import io.stagerelay.retry.RetryController;
import io.stagerelay.retry.RetryExhausted;
import io.stagerelay.retry.RetryOutcome;
import io.stagerelay.retry.RetryPolicy;
import io.stagerelay.retry.Sleeper;
import io.stagerelay.storage.Database;
import io.stagerelay.storage.RunLogRecord;
import io.stagerelay.storage.RunRow;
import io.stagerelay.storage.RunStore;
import io.stagerelay.util.Jsons;
import io.stagerelay.validation.OutputValidator;
import io.stagerelay.validation.ValidationResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public final class PipelineRunner {
    private final StageRelayConfig config;
    private final Database database;
    private final RunStore store;
    private final RunRecorder recorder;
    private final CapabilityRegistry registry;
    private final OutputValidator validator;
    private final FallbackSynthesizer fallbacks;
    private final RetryController retryController;
    private final AuditLogger auditLogger;
    private final PrintStream warnings;
    private final ConcurrentMap<String, Run> activeRuns;
    private volatile PipelineSettings settings;

    public PipelineRunner(StageRelayConfig config, CapabilityRegistry registry) {
        this(config, registry, Sleeper.SYSTEM, System.err);
    }

    public PipelineRunner(StageRelayConfig config, CapabilityRegistry registry, Sleeper sleeper, PrintStream warnings) {
        this(config, registry, sleeper, warnings, FallbackSynthesizer::standard);
    }

    public PipelineRunner(
            StageRelayConfig config,
            CapabilityRegistry registry,
            Sleeper sleeper,
            PrintStream warnings,
            Function<OutputValidator, FallbackSynthesizer> fallbackFactory
    ) {
        this.config = config;
        this.database = new Database(config);
        this.store = new RunStore(database);
        this.recorder = new RunRecorder(store);
        this.registry = registry;
        this.validator = new OutputValidator();
        this.fallbacks = fallbackFactory.apply(validator);
        this.retryController = new RetryController(sleeper);
        this.auditLogger = new AuditLogger(
                config.auditRoot().resolve("audit.log"),
                AuditLogger.loadOrCreateSigningSecret(config.securityRoot().resolve("audit-signing.key"))
        );
        this.warnings = warnings;
        this.activeRuns = new ConcurrentHashMap<>();
        this.settings = PipelineSettings.defaults();
    }

    public void init() {
        database.init();
        settings = PipelineSettings.load(config.settingsFile());
    }

    public PipelineSettings settings() {
        return settings;
    }

    public RunStore store() {
        return store;
    }

    public RunReplayer replayer() {
        return new RunReplayer(store);
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public RunOutcome run(PipelineDefinition definition, Map<String, String> overrides, String requestedRunId) {
        String runId = requestedRunId == null || requestedRunId.isBlank()
                ? TraceContextUtil.newRunId()
                : requestedRunId.trim();
        String traceId = TraceContextUtil.newTraceId();
        Map<String, String> params = definition.resolveParams(overrides);
        long now = Instant.now().toEpochMilli();

        TaskGraph graph;
        try {
            graph = definition.toGraph(settings);
            preflight(graph, Map.of());
        } catch (GraphException e) {
            store.insertRun(new RunRow(runId, definition.name(), RunStatus.ABORTED.name(), traceId,
                    Jsons.toCompactJson(definition), Jsons.toCompactJson(params), "[]",
                    null, e.getMessage(), now, now));
            auditLogger.log(AuditLogger.AuditEvent.run("run.start", "rejected", traceId, runId,
                    Map.of("pipeline", definition.name(), "error", e.getMessage())));
            warnings.println("[stagerelay] run " + runId + " aborted: " + e.getMessage());
            String output = TerminalOutput.render(runId, List.of(), Map.of());
            return new RunOutcome(runId, RunStatus.ABORTED, output, TerminalOutput.digest(output), e.getMessage(), List.of());
        }

        store.insertRun(new RunRow(runId, definition.name(), RunStatus.ACTIVE.name(), traceId,
                Jsons.toCompactJson(definition), Jsons.toCompactJson(params), Jsons.toCompactJson(graph.sinks()),
                null, null, now, now));
        auditLogger.log(AuditLogger.AuditEvent.run("run.start", "started", traceId, runId,
                Map.of("pipeline", definition.name(), "tasks", graph.size(), "sinks", graph.sinks())));
        return execute(new Run(runId, traceId, graph, params));
    }

    public RunOutcome resume(String runId) {
        RunRow row = store.findRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        List<RunLogRecord> records = store.listRecords(runId);
        if (RunStatus.COMPLETE.name().equals(row.status())) {
            Map<String, StageResult> results = RunReplayer.rebuild(records);
            String output = TerminalOutput.render(runId, row.sinks(), results);
            return new RunOutcome(runId, RunStatus.COMPLETE, output, TerminalOutput.digest(output), null,
                    reportsFromLog(results));
        }
        PipelineDefinition definition = PipelineLoader.fromJson(row.definitionJson());
        TaskGraph graph = definition.toGraph(settings);
        Map<String, StageResult> restored = RunReplayer.rebuild(records);
        preflight(graph, restored);

        Run run = new Run(runId, row.traceId(), graph, row.params());
        restored.values().forEach(run::restore);
        store.markActive(runId, Instant.now().toEpochMilli());
        auditLogger.log(AuditLogger.AuditEvent.run("run.resume", "started", run.traceId(), runId,
                Map.of("restored", restored.size(), "remaining", graph.size() - restored.size())));
        return execute(run);
    }

    public boolean cancel(String runId, String reason) {
        Run run = activeRuns.get(runId);
        if (run == null) {
            return false;
        }
        run.cancel(reason);
        return true;
    }

    public int cancelAll(String reason) {
        int n = 0;
        for (Run run : activeRuns.values()) {
            run.cancel(reason);
            n++;
        }
        return n;
    }

    public boolean awaitIdle(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        while (!activeRuns.isEmpty()) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(20L);
        }
        return true;
    }

    private void preflight(TaskGraph graph, Map<String, StageResult> alreadyRecorded) {
        for (TaskSpec task : graph.order()) {
            if (alreadyRecorded.containsKey(task.id())) {
                continue;
            }
            if (registry.findByKind(task.kind()).isEmpty()) {
                throw new GraphException("No capability registered for kind " + task.kind() + " (task " + task.id() + ")");
            }
            if (task.fallback() != null && !task.fallback().isBlank() && !fallbacks.hasStrategy(task.fallback())) {
                throw new GraphException("Unknown fallback strategy " + task.fallback() + " (task " + task.id() + ")");
            }
            try {
                validator.checkPolicy(task.output());
                fallbacks.checkSynthesizable(task.output());
            } catch (IllegalArgumentException e) {
                throw new GraphException("Invalid output policy for task " + task.id() + ": " + e.getMessage());
            }
        }
    }

    private RunOutcome execute(Run run) {
        activeRuns.put(run.runId(), run);
        ExecutorService workers = Executors.newFixedThreadPool(settings.workerThreads(), daemonThreads("stagerelay-worker"));
        ExecutorService calls = Executors.newCachedThreadPool(daemonThreads("stagerelay-call"));
        StageExecutor executor = new StageExecutor(registry, calls);
        try {
            Map<String, CompletableFuture<Boolean>> futures = new HashMap<>();
            for (TaskSpec task : run.graph().order()) {
                if (run.hasResult(task.id())) {
                    boolean usable = run.result(task.id()).map(StageResult::usable).orElse(false);
                    futures.put(task.id(), CompletableFuture.completedFuture(usable));
                    continue;
                }
                CompletableFuture<?>[] deps = task.dependsOn().stream()
                        .map(futures::get)
                        .toArray(CompletableFuture[]::new);
                futures.put(task.id(), CompletableFuture.allOf(deps)
                        .thenApplyAsync(ignored -> executeTask(run, task, executor), workers));
            }
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        } finally {
            workers.shutdownNow();
            calls.shutdownNow();
        }
        try {
            return finish(run);
        } finally {
            activeRuns.remove(run.runId());
        }
    }

    private boolean executeTask(Run run, TaskSpec task, StageExecutor executor) {
        String taskId = task.id();
        try {
            if (run.isCancelled()) {
                abort(run, task, run.abortReason());
                return false;
            }
            for (String dep : task.dependsOn()) {
                if (!run.result(dep).map(StageResult::usable).orElse(false)) {
                    abort(run, task, "dependency " + dep + " has no usable result");
                    return false;
                }
            }
            run.transition(taskId, TaskState.RUNNING);
            long startedAt = Instant.now().toEpochMilli();
            RetryPolicy policy = new RetryPolicy(task.maxAttempts(), settings.baseBackoffMs(), settings.maxBackoffMs());
            RetryOutcome outcome = retryController.execute(
                    policy,
                    attempt -> attempt(run, task, executor, attempt),
                    run::isCancelled,
                    (attempt, result, nextDelayMs) -> onAttempt(run, task, attempt, result, nextDelayMs)
            );

            StageResult result;
            if (outcome.status() == RetryOutcome.Status.SUCCEEDED) {
                run.transition(taskId, TaskState.SUCCEEDED);
                result = StageResult.success(taskId, outcome.output(), outcome.attempts(), startedAt, Instant.now().toEpochMilli());
            } else if (outcome.status() == RetryOutcome.Status.EXHAUSTED) {
                result = synthesizeFallback(run, task, outcome.toExhausted(taskId), startedAt);
                if (result == null) {
                    return false;
                }
            } else {
                abort(run, task, outcome.lastError() == null ? run.abortReason() : outcome.lastError());
                return false;
            }

            recorder.record(run, result);
            run.transition(taskId, TaskState.RECORDED);
            writeOutputFile(run, task, result);
            auditLogger.log(AuditLogger.AuditEvent.task("stage.record", result.status().name().toLowerCase(),
                    run.traceId(), run.runId(), taskId,
                    Map.of("provenance", result.provenance().name(), "attempts", result.attempts())));
            return result.usable();
        } catch (RuntimeException e) {
            String reason = "task " + taskId + " failed: " + e.getMessage();
            run.abortTask(taskId);
            run.cancel(reason);
            auditLogger.log(AuditLogger.AuditEvent.task("stage.error", "failed", run.traceId(), run.runId(), taskId,
                    Map.of("error", String.valueOf(e.getMessage()))));
            warnings.println("[stagerelay] " + reason);
            return false;
        }
    }

    private AttemptResult attempt(Run run, TaskSpec task, StageExecutor executor, int attempt) {
        StageExecutor.StageCall call = executor.runTask(task, run, attempt);
        if (!call.succeeded()) {
            return AttemptResult.callFailed(call.error());
        }
        ValidationResult verdict = validator.validate(call.raw(), task.output());
        if (!verdict.valid()) {
            return AttemptResult.rejected(verdict);
        }
        return AttemptResult.accepted(verdict.output());
    }

    private void onAttempt(Run run, TaskSpec task, int attempt, AttemptResult result, long nextDelayMs) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempt", attempt);
        details.put("max_attempts", task.maxAttempts());
        if (!result.isAccepted()) {
            details.put("error", result.error());
            details.put("next_delay_ms", nextDelayMs);
        }
        auditLogger.log(AuditLogger.AuditEvent.task("stage.attempt", result.isAccepted() ? "accepted" : "failed",
                run.traceId(), run.runId(), task.id(), details));
    }

    private StageResult synthesizeFallback(Run run, TaskSpec task, RetryExhausted exhausted, long startedAt) {
        String taskId = task.id();
        try {
            JsonNode payload = fallbacks.synthesize(
                    new FallbackRequest(task, run.upstreamOutputs(task), run.params(), exhausted.lastError()));
            run.transition(taskId, TaskState.FALLBACK_APPLIED);
            warnings.println("[stagerelay] task " + taskId + " used fallback after " + exhausted.attempts()
                    + " attempt(s): " + exhausted.lastError());
            auditLogger.log(AuditLogger.AuditEvent.task("stage.fallback", "applied", run.traceId(), run.runId(), taskId,
                    Map.of("attempts", exhausted.attempts(), "reason", String.valueOf(exhausted.lastError()),
                            "strategy", fallbacks.strategyFor(task).name())));
            return StageResult.fallback(taskId, payload, exhausted.attempts(), exhausted.lastError(),
                    startedAt, Instant.now().toEpochMilli());
        } catch (FallbackSynthesisException e) {
            recorder.record(run, StageResult.failed(taskId, exhausted.attempts(), e.getMessage(),
                    startedAt, Instant.now().toEpochMilli()));
            run.abortTask(taskId);
            run.cancel(e.getMessage());
            warnings.println("[stagerelay] " + e.getMessage());
            auditLogger.log(AuditLogger.AuditEvent.task("stage.fallback", "failed", run.traceId(), run.runId(), taskId,
                    Map.of("error", e.getMessage())));
            return null;
        }
    }

    private void abort(Run run, TaskSpec task, String reason) {
        run.abortTask(task.id());
        auditLogger.log(AuditLogger.AuditEvent.task("stage.abort", "aborted", run.traceId(), run.runId(), task.id(),
                Map.of("reason", reason == null ? "cancelled" : reason)));
    }

    private void writeOutputFile(Run run, TaskSpec task, StageResult result) {
        if (task.outputFile() == null || task.outputFile().isBlank() || !result.usable()) {
            return;
        }
        Path dir = config.outputsRoot().resolve(run.runId()).normalize();
        Path target = dir.resolve(task.outputFile()).normalize();
        if (!target.startsWith(dir)) {
            throw new IllegalArgumentException("Output file escapes the run output directory: " + task.outputFile());
        }
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, Jsons.toJson(result.payloadNode()) + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write output file " + target, e);
        }
    }

    private RunOutcome finish(Run run) {
        List<String> sinks = run.graph().sinks();
        boolean sinksReady = sinks.stream().allMatch(s -> run.result(s).map(StageResult::usable).orElse(false));
        RunStatus status;
        if (!run.isCancelled() && sinksReady && run.complete()) {
            status = RunStatus.COMPLETE;
        } else {
            run.cancel(sinksReady ? null : "not every sink produced a result");
            status = RunStatus.ABORTED;
        }
        String output = TerminalOutput.render(run.runId(), sinks, run.results());
        String digest = TerminalOutput.digest(output);
        String error = status == RunStatus.ABORTED ? run.abortReason() : null;
        store.finishRun(run.runId(), status.name(), digest, error, Instant.now().toEpochMilli());

        List<TaskReport> reports = new ArrayList<>();
        for (TaskSpec task : run.graph().order()) {
            StageResult r = run.result(task.id()).orElse(null);
            reports.add(new TaskReport(
                    task.id(),
                    run.state(task.id()),
                    r == null ? null : r.status(),
                    r == null ? null : r.provenance(),
                    r == null ? 0 : r.attempts(),
                    r == null ? null : r.lastError()
            ));
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("digest_prefix", digest.substring(0, 16));
        details.put("fallbacks", reports.stream().filter(t -> t.provenance() == Provenance.FALLBACK).map(TaskReport::taskId).toList());
        if (error != null) {
            details.put("error", error);
        }
        auditLogger.log(AuditLogger.AuditEvent.run("run.finish", status.name().toLowerCase(), run.traceId(), run.runId(), details));
        return new RunOutcome(run.runId(), status, output, digest, error, reports);
    }

    private static List<TaskReport> reportsFromLog(Map<String, StageResult> results) {
        List<TaskReport> out = new ArrayList<>();
        for (StageResult r : results.values()) {
            out.add(new TaskReport(r.taskId(), TaskState.RECORDED, r.status(), r.provenance(), r.attempts(), r.lastError()));
        }
        return out;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record RunOutcome(
            String runId,
            RunStatus status,
            String output,
            String outputDigest,
            String error,
            List<TaskReport> tasks
    ) {
    }

    public record TaskReport(
            String taskId,
            TaskState state,
            StageStatus status,
            Provenance provenance,
            int attempts,
            String lastError
    ) {
    }
}
