package io.stagerelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagerelay.capability.CapabilityRegistry;
import io.stagerelay.capability.CapabilityResult;
import io.stagerelay.config.StageRelayConfig;
import io.stagerelay.fallback.FallbackRequest;
import io.stagerelay.fallback.FallbackStrategy;
import io.stagerelay.fallback.FallbackSynthesizer;
import io.stagerelay.pipeline.PipelineDefinition;
import io.stagerelay.pipeline.PipelineLoader;
import io.stagerelay.pipeline.TaskDescriptor;
import io.stagerelay.replay.RunNotFoundException;
import io.stagerelay.retry.Sleeper;
import io.stagerelay.storage.RunLogRecord;
import io.stagerelay.util.Jsons;
import io.stagerelay.validation.FieldRule;
import io.stagerelay.validation.OutputPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.stagerelay.runtime.TestPipelines.value;

final class PipelineRunnerTest {

    @Test
    void timedOutStageIsRetriedAndItsRealOutputFlowsDownstream() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-timeout-");
        try {
            List<Long> sleeps = new CopyOnWriteArrayList<>();
            RecordingCapability a = RecordingCapability.returning("a", value("screened universe"));
            RecordingCapability b = new RecordingCapability("b", (call, request) -> {
                if (call <= 2) {
                    Thread.sleep(10_000L);
                }
                return CapabilityResult.ok(value("fundamentals for MSFT"));
            });
            RecordingCapability c = RecordingCapability.returning("c", value("sentiment for MSFT"));
            RecordingCapability d = RecordingCapability.returning("d", value("integrated view"));
            PipelineRunner runner = runner(root, registry(a, b, c, d), sleeps::add);

            PipelineRunner.RunOutcome outcome = runner.run(TestPipelines.diamond(300L), Map.of(), "run-timeout");

            Assertions.assertEquals(RunStatus.COMPLETE, outcome.status());
            Assertions.assertEquals(3, b.calls());
            Assertions.assertEquals(List.of(1_000L, 2_000L), sleeps);
            Assertions.assertEquals(Jsons.readTree(value("fundamentals for MSFT")), d.lastRequest().input().at("/inputs/b"));
            PipelineRunner.TaskReport reportB = report(outcome, "b");
            Assertions.assertEquals(TaskState.RECORDED, reportB.state());
            Assertions.assertEquals(StageStatus.SUCCESS, reportB.status());
            Assertions.assertEquals(Provenance.CAPABILITY, reportB.provenance());
            Assertions.assertEquals(3, reportB.attempts());
            Assertions.assertEquals(1, a.calls());
            Assertions.assertEquals(1, d.calls());

            JsonNode output = Jsons.readTree(outcome.output());
            Assertions.assertEquals("run-timeout", output.get("run_id").asText());
            Assertions.assertEquals("CAPABILITY", output.at("/outputs/d/provenance").asText());
            Assertions.assertEquals("integrated view", output.at("/outputs/d/payload/value").asText());
            Assertions.assertEquals(TerminalOutput.digest(outcome.output()), runner.store().findRun("run-timeout").orElseThrow().outputDigest());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void placeholderOutputIsReplacedByFallbackThatDependentsReceive() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-placeholder-");
        try {
            ByteArrayOutputStream warnings = new ByteArrayOutputStream();
            RecordingCapability c = RecordingCapability.returning("c", value("Company A"));
            RecordingCapability d = RecordingCapability.returning("d", value("integrated view"));
            PipelineRunner runner = new PipelineRunner(StageRelayConfig.fromRoot(root.toString()),
                    registry(RecordingCapability.returning("a", value("screen")),
                            RecordingCapability.returning("b", value("fundamentals")), c, d),
                    ms -> {
                    }, new PrintStream(warnings, true, StandardCharsets.UTF_8));
            runner.init();

            PipelineRunner.RunOutcome outcome = runner.run(TestPipelines.diamond(5_000L), Map.of(), "run-placeholder");

            Assertions.assertEquals(RunStatus.COMPLETE, outcome.status());
            Assertions.assertEquals(3, c.calls());
            PipelineRunner.TaskReport reportC = report(outcome, "c");
            Assertions.assertEquals(StageStatus.FALLBACK_USED, reportC.status());
            Assertions.assertEquals(Provenance.FALLBACK, reportC.provenance());
            Assertions.assertTrue(reportC.lastError().contains("placeholder value at value"), reportC.lastError());

            RunLogRecord recordC = record(runner, "run-placeholder", "c");
            Assertions.assertEquals(recordC.payload(), d.lastRequest().input().at("/inputs/c"));
            Assertions.assertTrue(recordC.payload().get("value").asText().startsWith("Unavailable: synthesized fallback for c.value"));
            Assertions.assertTrue(warnings.toString(StandardCharsets.UTF_8).contains("[stagerelay] task c used fallback after 3 attempt(s)"));
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void pipelineCompletesIdenticallyWhenEveryCallFails() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-allfail-");
        try {
            RecordingCapability a = RecordingCapability.failing("a", "upstream service unavailable");
            PipelineRunner runner = runner(root, registry(a,
                    RecordingCapability.failing("b", "boom"),
                    RecordingCapability.failing("c", "boom"),
                    RecordingCapability.failing("d", "boom")), ms -> {
            });

            PipelineRunner.RunOutcome first = runner.run(TestPipelines.diamond(1_000L), Map.of(), "run-fail-1");
            PipelineRunner.RunOutcome second = runner.run(TestPipelines.diamond(1_000L), Map.of(), "run-fail-2");

            Assertions.assertEquals(RunStatus.COMPLETE, first.status());
            Assertions.assertEquals(RunStatus.COMPLETE, second.status());
            Assertions.assertEquals(6, a.calls());
            for (PipelineRunner.TaskReport task : first.tasks()) {
                Assertions.assertEquals(Provenance.FALLBACK, task.provenance(), task.taskId());
                Assertions.assertEquals(3, task.attempts(), task.taskId());
            }
            Assertions.assertEquals(Jsons.readTree(first.output()).get("outputs"), Jsons.readTree(second.output()).get("outputs"));
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void failedFallbackSynthesisAbortsTheRun() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-synthfail-");
        try {
            PipelineDefinition pipeline = new PipelineDefinition("synth-fail", Map.of(), List.of(), List.of(
                    new TaskDescriptor("pick", "pick", List.of(), Map.of(), 1_000L, 2, "broken", Map.of(), null,
                            TestPipelines.VALUE_POLICY),
                    TestPipelines.task("report", List.of("pick"), 1_000L, 2)
            ));
            RecordingCapability report = RecordingCapability.returning("report", value("report"));
            PipelineRunner runner = new PipelineRunner(StageRelayConfig.fromRoot(root.toString()),
                    registry(RecordingCapability.failing("pick", "boom"), report), ms -> {
            }, new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
                    validator -> FallbackSynthesizer.standard(validator).register(new FallbackStrategy() {
                        @Override
                        public String name() {
                            return "broken";
                        }

                        @Override
                        public ObjectNode synthesize(FallbackRequest request) {
                            throw new IllegalStateException("reference data unavailable");
                        }
                    }));
            runner.init();

            PipelineRunner.RunOutcome outcome = runner.run(pipeline, Map.of(), "run-synth-fail");

            Assertions.assertEquals(RunStatus.ABORTED, outcome.status());
            Assertions.assertTrue(outcome.error().contains("Fallback synthesis failed for task pick"), outcome.error());
            Assertions.assertEquals(0, report.calls());
            Assertions.assertEquals(TaskState.ABORTED, report(outcome, "pick").state());
            Assertions.assertEquals(StageStatus.FAILED, report(outcome, "pick").status());
            Assertions.assertEquals(TaskState.ABORTED, report(outcome, "report").state());
            List<RunLogRecord> records = runner.store().listRecords("run-synth-fail");
            Assertions.assertEquals(1, records.size());
            Assertions.assertEquals(StageStatus.FAILED, records.get(0).status());
            Assertions.assertEquals("ABORTED", runner.store().findRun("run-synth-fail").orElseThrow().status());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void policyNoFallbackCanSatisfyIsRejectedBeforeAnyCall() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-unsatisfiable-");
        try {
            OutputPolicy isin = OutputPolicy.of(FieldRule.keyString("isin", "^[A-Z]{2}[0-9]{9}[0-9]$"));
            PipelineDefinition pipeline = new PipelineDefinition("isin", Map.of(), List.of(), List.of(
                    new TaskDescriptor("pick", "pick", List.of(), Map.of(), 1_000L, 2, null, Map.of(), null, isin)
            ));
            RecordingCapability pick = RecordingCapability.returning("pick", "{\"isin\":\"US5949181045\"}");
            PipelineRunner runner = runner(root, registry(pick), ms -> {
            });

            PipelineRunner.RunOutcome outcome = runner.run(pipeline, Map.of(), "run-isin");

            Assertions.assertEquals(RunStatus.ABORTED, outcome.status());
            Assertions.assertTrue(outcome.error().contains("isin has pattern"), outcome.error());
            Assertions.assertEquals(0, pick.calls());
            Assertions.assertTrue(runner.store().listRecords("run-isin").isEmpty());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void bundledPipelineCompletesWhenScreenRepeatsTickersAndAnalystsFail() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-repeated-tickers-");
        try {
            RecordingCapability screen = RecordingCapability.returning("market-screen", """
                    {"companies":[
                      {"company_name":"Microsoft Corporation","ticker":"MSFT","sector":"Information Technology"},
                      {"company_name":"Microsoft Corp. Class A","ticker":"MSFT","sector":"Information Technology"},
                      {"company_name":"Apple Inc.","ticker":"AAPL","sector":"Information Technology"},
                      {"company_name":"Apple Inc. common stock","ticker":"AAPL","sector":"Information Technology"},
                      {"company_name":"Apple Computer","ticker":"AAPL","sector":"Information Technology"}
                    ]}""");
            PipelineRunner runner = runner(root, registry(screen,
                    RecordingCapability.failing("fundamental-analysis", "upstream 503"),
                    RecordingCapability.failing("sentiment-analysis", "upstream 503"),
                    RecordingCapability.failing("integrated-analysis", "upstream 503"),
                    RecordingCapability.failing("investment-thesis", "upstream 503")), ms -> {
            });

            PipelineRunner.RunOutcome outcome = runner.run(PipelineLoader.bundled(), Map.of(), "run-repeated");

            Assertions.assertEquals(RunStatus.COMPLETE, outcome.status(), outcome.error());
            Assertions.assertEquals(StageStatus.SUCCESS, report(outcome, "screen_universe").status());
            for (String task : List.of("analyze_fundamentals", "analyze_sentiment", "integrated_analysis", "investment_thesis")) {
                Assertions.assertEquals(StageStatus.FALLBACK_USED, report(outcome, task).status(), task);
            }
            JsonNode investments = Jsons.readTree(outcome.output()).at("/outputs/investment_thesis/payload/investments");
            Assertions.assertTrue(investments.size() >= 3);
            Set<String> tickers = new HashSet<>();
            for (JsonNode investment : investments) {
                Assertions.assertTrue(tickers.add(investment.get("ticker").asText()), investments.toString());
            }
            Assertions.assertTrue(tickers.containsAll(List.of("MSFT", "AAPL")), tickers.toString());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void bundledPipelineFallsBackEndToEndWhenEveryCapabilityFails() throws Exception {
        Path first = Files.createTempDirectory("stagerelay-test-all-failing-");
        Path second = Files.createTempDirectory("stagerelay-test-all-failing-again-");
        try {
            PipelineRunner.RunOutcome outcome = runner(first, allFailing(), ms -> {
            }).run(PipelineLoader.bundled(), Map.of(), "run-all-failing");
            PipelineRunner.RunOutcome again = runner(second, allFailing(), ms -> {
            }).run(PipelineLoader.bundled(), Map.of(), "run-all-failing");

            Assertions.assertEquals(RunStatus.COMPLETE, outcome.status(), outcome.error());
            for (PipelineRunner.TaskReport task : outcome.tasks()) {
                Assertions.assertEquals(StageStatus.FALLBACK_USED, task.status(), task.taskId());
            }
            JsonNode investments = Jsons.readTree(outcome.output()).at("/outputs/investment_thesis/payload/investments");
            Assertions.assertEquals(5, investments.size());
            Assertions.assertEquals(Jsons.readTree(outcome.output()).get("outputs"), Jsons.readTree(again.output()).get("outputs"));
        } finally {
            TestPipelines.deleteRecursively(first);
            TestPipelines.deleteRecursively(second);
        }
    }

    @Test
    void missingCapabilityAbortsBeforeAnyStageRuns() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-missing-");
        try {
            RecordingCapability a = RecordingCapability.returning("a", value("screen"));
            PipelineRunner runner = runner(root, registry(a,
                    RecordingCapability.returning("b", value("b")),
                    RecordingCapability.returning("c", value("c"))), ms -> {
            });

            PipelineRunner.RunOutcome outcome = runner.run(TestPipelines.diamond(1_000L), Map.of(), "run-missing");

            Assertions.assertEquals(RunStatus.ABORTED, outcome.status());
            Assertions.assertTrue(outcome.error().contains("No capability registered for kind d"), outcome.error());
            Assertions.assertEquals(0, a.calls());
            Assertions.assertEquals("ABORTED", runner.store().findRun("run-missing").orElseThrow().status());
            Assertions.assertTrue(runner.store().listRecords("run-missing").isEmpty());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void cancellationInterruptsInFlightCallsAndAbortsRemainingTasks() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-cancel-");
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            CountDownLatch started = new CountDownLatch(1);
            RecordingCapability a = new RecordingCapability("a", (call, request) -> {
                started.countDown();
                Thread.sleep(60_000L);
                return CapabilityResult.ok(value("too late"));
            });
            RecordingCapability b = RecordingCapability.returning("b", value("b"));
            PipelineRunner runner = runner(root, registry(a, b,
                    RecordingCapability.returning("c", value("c")),
                    RecordingCapability.returning("d", value("d"))), ms -> {
            });

            Future<PipelineRunner.RunOutcome> pending = caller.submit(
                    () -> runner.run(TestPipelines.diamond(120_000L), Map.of(), "run-cancel"));
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            Assertions.assertFalse(runner.cancel("run-unknown", "operator abort"));
            Assertions.assertTrue(runner.cancel("run-cancel", "operator abort"));
            PipelineRunner.RunOutcome outcome = pending.get(10, TimeUnit.SECONDS);

            Assertions.assertEquals(RunStatus.ABORTED, outcome.status());
            Assertions.assertEquals("operator abort", outcome.error());
            Assertions.assertEquals(1, a.calls());
            Assertions.assertEquals(0, b.calls());
            for (PipelineRunner.TaskReport task : outcome.tasks()) {
                Assertions.assertEquals(TaskState.ABORTED, task.state(), task.taskId());
            }
            Assertions.assertTrue(runner.store().listRecords("run-cancel").isEmpty());
            Assertions.assertTrue(runner.awaitIdle(1_000L));
        } finally {
            caller.shutdownNow();
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void resumeRunsOnlyTasksWithoutRecords() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-resume-");
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            CountDownLatch started = new CountDownLatch(1);
            RecordingCapability a = RecordingCapability.returning("a", value("screen"));
            RecordingCapability hangingB = new RecordingCapability("b", (call, request) -> {
                started.countDown();
                Thread.sleep(60_000L);
                return CapabilityResult.ok(value("too late"));
            });
            PipelineRunner first = runner(root, registry(a, hangingB), ms -> {
            });
            Future<PipelineRunner.RunOutcome> pending = caller.submit(
                    () -> first.run(TestPipelines.chain(120_000L), Map.of(), "run-resume"));
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            first.cancel("run-resume", "shutdown");
            Assertions.assertEquals(RunStatus.ABORTED, pending.get(10, TimeUnit.SECONDS).status());
            Assertions.assertEquals(1, first.store().listRecords("run-resume").size());

            RecordingCapability secondA = RecordingCapability.returning("a", value("different screen"));
            RecordingCapability secondB = RecordingCapability.returning("b", value("fundamentals"));
            PipelineRunner second = runner(root, registry(secondA, secondB), ms -> {
            });
            PipelineRunner.RunOutcome resumed = second.resume("run-resume");

            Assertions.assertEquals(RunStatus.COMPLETE, resumed.status());
            Assertions.assertEquals(0, secondA.calls());
            Assertions.assertEquals(1, secondB.calls());
            Assertions.assertEquals(Jsons.readTree(value("screen")), secondB.lastRequest().input().at("/inputs/a"));
            List<RunLogRecord> records = second.store().listRecords("run-resume");
            Assertions.assertEquals(List.of("a", "b"), records.stream().map(RunLogRecord::taskId).toList());
            Assertions.assertEquals(List.of(1L, 2L), records.stream().map(RunLogRecord::seq).toList());

            PipelineRunner.RunOutcome again = second.resume("run-resume");
            Assertions.assertEquals(RunStatus.COMPLETE, again.status());
            Assertions.assertEquals(resumed.output(), again.output());
            Assertions.assertEquals(1, secondB.calls());
            Assertions.assertThrows(RunNotFoundException.class, () -> second.resume("run-nope"));
        } finally {
            caller.shutdownNow();
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void bindingsSelectUpstreamFieldsAndParams() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-bindings-");
        try {
            PipelineDefinition pipeline = new PipelineDefinition("bindings", Map.of("market", "US"), List.of("b"), List.of(
                    TestPipelines.task("a", List.of(), 1_000L, 1),
                    new TaskDescriptor("b", "b", List.of("a"),
                            Map.of("screen", "a#/value", "market", "params#/market", "absent", "a#/missing"),
                            1_000L, 1, null, Map.of("role", "analyst"), "b/result.json", TestPipelines.VALUE_POLICY)
            ));
            RecordingCapability b = RecordingCapability.returning("b", value("analysis"));
            PipelineRunner runner = runner(root, registry(RecordingCapability.returning("a", value("screened")), b), ms -> {
            });

            PipelineRunner.RunOutcome outcome = runner.run(pipeline, Map.of("market", "EU"), "run-bindings");

            Assertions.assertEquals(RunStatus.COMPLETE, outcome.status());
            JsonNode input = b.lastRequest().input();
            Assertions.assertEquals("screened", input.at("/inputs/screen").asText());
            Assertions.assertEquals("EU", input.at("/inputs/market").asText());
            Assertions.assertTrue(input.at("/inputs/absent").isNull());
            Assertions.assertEquals("analyst", input.at("/metadata/role").asText());
            Assertions.assertEquals("b", input.get("task_id").asText());
            Assertions.assertEquals(1, input.get("attempt").asInt());
            Assertions.assertEquals("run-bindings", b.lastRequest().runId());

            Path written = root.resolve("outputs").resolve("run-bindings").resolve("b").resolve("result.json");
            Assertions.assertTrue(Files.exists(written));
            Assertions.assertEquals(Jsons.readTree(value("analysis")), Jsons.readTree(Files.readString(written)));
            Assertions.assertFalse(runner.auditTail(50).isEmpty());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void duplicateRunIdIsRejected() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-dup-");
        try {
            PipelineRunner runner = runner(root, registry(
                    RecordingCapability.returning("a", value("x")),
                    RecordingCapability.returning("b", value("y"))), ms -> {
            });
            runner.run(TestPipelines.chain(1_000L), Map.of(), "run-dup");

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runner.run(TestPipelines.chain(1_000L), Map.of(), "run-dup"));
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    private static PipelineRunner runner(Path root, CapabilityRegistry registry, Sleeper sleeper) {
        PipelineRunner runner = new PipelineRunner(StageRelayConfig.fromRoot(root.toString()), registry, sleeper,
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        runner.init();
        return runner;
    }

    private static CapabilityRegistry allFailing() {
        return registry(
                RecordingCapability.failing("market-screen", "quota exceeded"),
                RecordingCapability.failing("fundamental-analysis", "quota exceeded"),
                RecordingCapability.failing("sentiment-analysis", "quota exceeded"),
                RecordingCapability.failing("integrated-analysis", "quota exceeded"),
                RecordingCapability.failing("investment-thesis", "quota exceeded"));
    }

    private static CapabilityRegistry registry(RecordingCapability... capabilities) {
        return new CapabilityRegistry().registerAll(List.of(capabilities));
    }

    private static PipelineRunner.TaskReport report(PipelineRunner.RunOutcome outcome, String taskId) {
        return outcome.tasks().stream().filter(t -> t.taskId().equals(taskId)).findFirst().orElseThrow();
    }

    private static RunLogRecord record(PipelineRunner runner, String runId, String taskId) {
        return runner.store().listRecords(runId).stream().filter(r -> r.taskId().equals(taskId)).findFirst().orElseThrow();
    }
}
