package io.stagerelay.cli;

import io.stagerelay.capability.CapabilityLoader;
import io.stagerelay.capability.CapabilityRegistry;
import io.stagerelay.capability.SyntheticCapability;
import io.stagerelay.config.StageRelayConfig;
import io.stagerelay.fallback.FallbackSynthesizer;
import io.stagerelay.graph.GraphException;
import io.stagerelay.graph.TaskGraph;
import io.stagerelay.graph.TaskSpec;
import io.stagerelay.pipeline.PipelineDefinition;
import io.stagerelay.pipeline.PipelineLoader;
import io.stagerelay.replay.RunNotFoundException;
import io.stagerelay.replay.RunReplayer;
import io.stagerelay.retry.Sleeper;
import io.stagerelay.runtime.PipelineRunner;
import io.stagerelay.runtime.RunStatus;
import io.stagerelay.storage.RunLogRecord;
import io.stagerelay.storage.RunRow;
import io.stagerelay.util.Jsons;
import io.stagerelay.validation.OutputValidator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "stagerelay",
        mixinStandardHelpOptions = true,
        description = "Fault-tolerant multi-stage pipeline runner",
        subcommands = {
                StageRelayCommand.RunCommand.class,
                StageRelayCommand.ReplayCommand.class,
                StageRelayCommand.TestCommand.class,
                StageRelayCommand.ResumeCommand.class,
                StageRelayCommand.RunsCommand.class,
                StageRelayCommand.ShowCommand.class,
                StageRelayCommand.ValidateCommand.class,
                StageRelayCommand.AuditTailCommand.class
        }
)
public final class StageRelayCommand implements Runnable {
    static final int EXIT_COMPLETE = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_RUN_NOT_FOUND = 2;

    static final Map<String, String> TEST_PARAMS = Map.of(
            "market", "US",
            "stock_universe", "S&P 500 large caps",
            "analysis_date", "2024-01-02",
            "universe_size", "5"
    );

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = StageRelayConfig.DEFAULT_ROOT)
    String root;

    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public void run() {
        out.println("Use subcommands: run | replay | test | resume | runs | show | validate | audit-tail");
    }

    StageRelayConfig config() {
        return StageRelayConfig.fromRoot(root);
    }

    PipelineRunner runner(CapabilityRegistry registry) {
        PipelineRunner runner = new PipelineRunner(config(), registry, Sleeper.SYSTEM, err);
        runner.init();
        return runner;
    }

    CapabilityRegistry configuredCapabilities(String file) {
        Path path = file == null || file.isBlank() ? config().capabilitiesFile() : Path.of(file);
        if (file != null && !file.isBlank() && !path.toFile().exists()) {
            throw new IllegalArgumentException("Capability file not found: " + path);
        }
        return CapabilityLoader.load(path, System.getenv());
    }

    int report(PipelineRunner.RunOutcome outcome) {
        out.println(outcome.output());
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("run_id", outcome.runId());
        summary.put("status", outcome.status());
        summary.put("output_digest", outcome.outputDigest());
        if (outcome.error() != null) {
            summary.put("error", outcome.error());
        }
        summary.put("tasks", outcome.tasks());
        err.println(Jsons.toJson(summary));
        return outcome.status() == RunStatus.COMPLETE ? EXIT_COMPLETE : EXIT_ABORTED;
    }

    int notFound(RunNotFoundException e) {
        out.println(Jsons.toCompactJson(Map.of("error", "run not found", "run_id", e.runId())));
        return EXIT_RUN_NOT_FOUND;
    }

    void cancelOnShutdown(PipelineRunner runner) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (runner.cancelAll("interrupted by operator") == 0) {
                return;
            }
            try {
                runner.awaitIdle(runner.settings().maxBackoffMs() + 5_000L);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
        }, "stagerelay-shutdown-hook"));
    }

    @Command(name = "run", description = "Execute a pipeline and record every stage result")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--pipeline"}, description = "Pipeline JSON file (default: bundled equity-research pipeline)")
        String pipeline;

        @Option(names = {"--param"}, description = "Run parameter override, key=value (repeatable)")
        Map<String, String> params = new LinkedHashMap<>();

        @Option(names = {"--run_id", "--run-id"}, description = "Run id to use instead of a generated one")
        String runId;

        @Option(names = {"--capabilities"}, description = "Capability bindings file (default: <root>/capabilities.json)")
        String capabilities;

        @Override
        public Integer call() {
            PipelineRunner runner = parent.runner(parent.configuredCapabilities(capabilities));
            parent.cancelOnShutdown(runner);
            PipelineDefinition definition = PipelineLoader.load(pipeline);
            return parent.report(runner.run(definition, params, runId));
        }
    }

    @Command(name = "replay", description = "Re-render a recorded run from its log without invoking capabilities")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--run_id", "--run-id"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() {
            PipelineRunner runner = parent.runner(new CapabilityRegistry());
            RunReplayer.ReplayOutcome outcome;
            try {
                outcome = runner.replayer().replay(runId);
            } catch (RunNotFoundException e) {
                return parent.notFound(e);
            }
            parent.out.println(outcome.output());
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("run_id", outcome.runId());
            summary.put("status", outcome.status());
            summary.put("records", outcome.records());
            summary.put("output_digest", outcome.outputDigest());
            summary.put("digest_matches", outcome.digestMatches());
            summary.put("missing_sinks", outcome.missingSinks());
            parent.err.println(Jsons.toJson(summary));
            if (outcome.status() == RunStatus.COMPLETE && outcome.digestMatches()) {
                return EXIT_COMPLETE;
            }
            return EXIT_ABORTED;
        }
    }

    @Command(name = "test", description = "Run a pipeline against the bundled synthetic capabilities with fixed params")
    static final class TestCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--pipeline"}, description = "Pipeline JSON file (default: bundled equity-research pipeline)")
        String pipeline;

        @Override
        public Integer call() {
            CapabilityRegistry registry = new CapabilityRegistry().registerAll(SyntheticCapability.bundled());
            PipelineRunner runner = parent.runner(registry);
            parent.cancelOnShutdown(runner);
            PipelineDefinition definition = PipelineLoader.load(pipeline);
            return parent.report(runner.run(definition, TEST_PARAMS, null));
        }
    }

    @Command(name = "resume", description = "Continue an interrupted run, executing only tasks missing from its log")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--run_id", "--run-id"}, required = true, description = "Run id")
        String runId;

        @Option(names = {"--capabilities"}, description = "Capability bindings file (default: <root>/capabilities.json)")
        String capabilities;

        @Override
        public Integer call() {
            PipelineRunner runner = parent.runner(parent.configuredCapabilities(capabilities));
            parent.cancelOnShutdown(runner);
            try {
                return parent.report(runner.resume(runId));
            } catch (RunNotFoundException e) {
                return parent.notFound(e);
            } catch (GraphException e) {
                parent.out.println(Jsons.toCompactJson(Map.of("error", e.getMessage(), "run_id", runId)));
                return EXIT_ABORTED;
            }
        }
    }

    @Command(name = "runs", description = "List recorded runs, newest first")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: ACTIVE|COMPLETE|ABORTED")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            PipelineRunner runner = parent.runner(new CapabilityRegistry());
            List<Map<String, Object>> rows = new ArrayList<>();
            for (RunRow row : runner.store().listRuns(status, limit)) {
                rows.add(runSummary(row));
            }
            parent.out.println(Jsons.toJson(rows));
            return 0;
        }
    }

    @Command(name = "show", description = "Show a run and its log records")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--run_id", "--run-id"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() {
            PipelineRunner runner = parent.runner(new CapabilityRegistry());
            RunRow row = runner.store().findRun(runId).orElse(null);
            if (row == null) {
                return parent.notFound(new RunNotFoundException(runId));
            }
            Map<String, Object> view = runSummary(row);
            view.put("params", row.params());
            view.put("sinks", row.sinks());
            List<Map<String, Object>> records = new ArrayList<>();
            for (RunLogRecord record : runner.store().listRecords(runId)) {
                Map<String, Object> r = new LinkedHashMap<>();
                r.put("seq", record.seq());
                r.put("task_id", record.taskId());
                r.put("status", record.status());
                r.put("provenance", record.provenance());
                r.put("attempts", record.attempts());
                r.put("error", record.error());
                r.put("duration_ms", record.finishedAtMs() - record.startedAtMs());
                records.add(r);
            }
            view.put("records", records);
            parent.out.println(Jsons.toJson(view));
            return 0;
        }
    }

    @Command(name = "validate", description = "Check a pipeline definition and print its execution order")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--pipeline"}, description = "Pipeline JSON file (default: bundled equity-research pipeline)")
        String pipeline;

        @Override
        public Integer call() {
            PipelineRunner runner = parent.runner(new CapabilityRegistry());
            PipelineDefinition definition = PipelineLoader.load(pipeline);
            TaskGraph graph;
            try {
                graph = definition.toGraph(runner.settings());
                OutputValidator validator = new OutputValidator();
                FallbackSynthesizer fallbacks = FallbackSynthesizer.standard(validator);
                for (TaskSpec task : graph.order()) {
                    validator.checkPolicy(task.output());
                    fallbacks.checkSynthesizable(task.output());
                }
            } catch (GraphException | IllegalArgumentException e) {
                parent.out.println(Jsons.toCompactJson(Map.of("valid", false, "error", String.valueOf(e.getMessage()))));
                return EXIT_ABORTED;
            }
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("valid", true);
            view.put("name", definition.name());
            view.put("order", graph.orderIds());
            view.put("entry_points", graph.entryPoints());
            view.put("sinks", graph.sinks());
            view.put("kinds", graph.order().stream().map(TaskSpec::kind).distinct().toList());
            parent.out.println(Jsons.toJson(view));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        StageRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            PipelineRunner runner = parent.runner(new CapabilityRegistry());
            for (String row : runner.auditTail(lines)) {
                parent.out.println(row);
            }
            return 0;
        }
    }

    private static Map<String, Object> runSummary(RunRow row) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("run_id", row.runId());
        view.put("pipeline", row.pipelineName());
        view.put("status", row.status());
        view.put("trace_id", row.traceId());
        view.put("output_digest", row.outputDigest());
        view.put("last_error", row.lastError());
        view.put("created_at_ms", row.createdAtMs());
        view.put("updated_at_ms", row.updatedAtMs());
        return view;
    }
}
