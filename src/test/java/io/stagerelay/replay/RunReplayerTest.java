package io.stagerelay.replay;

import io.stagerelay.capability.CapabilityRegistry;
import io.stagerelay.config.StageRelayConfig;
import io.stagerelay.runtime.PipelineRunner;
import io.stagerelay.runtime.RecordingCapability;
import io.stagerelay.runtime.RunStatus;
import io.stagerelay.runtime.TestPipelines;
import io.stagerelay.storage.RunLogRecord;
import io.stagerelay.storage.RunRow;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static io.stagerelay.runtime.TestPipelines.value;

final class RunReplayerTest {

    @Test
    void replayReproducesTerminalOutputWithoutInvokingCapabilities() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-replay-");
        try {
            RecordingCapability a = RecordingCapability.returning("a", value("screen"));
            RecordingCapability b = RecordingCapability.returning("b", value("fundamentals"));
            RecordingCapability c = RecordingCapability.returning("c", value("Company B"));
            RecordingCapability d = RecordingCapability.returning("d", value("thesis"));
            PipelineRunner runner = runner(root, new CapabilityRegistry().registerAll(List.of(a, b, c, d)));
            PipelineRunner.RunOutcome outcome = runner.run(TestPipelines.diamond(2_000L), Map.of(), "run-replay");
            int callsBefore = a.calls() + b.calls() + c.calls() + d.calls();

            RunReplayer.ReplayOutcome replay = runner.replayer().replay("run-replay");
            RunReplayer.ReplayOutcome again = new RunReplayer(runner.store()).replay("run-replay");

            Assertions.assertEquals(RunStatus.COMPLETE, outcome.status());
            Assertions.assertEquals(outcome.output(), replay.output());
            Assertions.assertEquals(replay.output(), again.output());
            Assertions.assertEquals(outcome.outputDigest(), replay.outputDigest());
            Assertions.assertTrue(replay.digestMatches());
            Assertions.assertEquals(RunStatus.COMPLETE, replay.status());
            Assertions.assertEquals(4, replay.records());
            Assertions.assertTrue(replay.missingSinks().isEmpty());
            Assertions.assertEquals(callsBefore, a.calls() + b.calls() + c.calls() + d.calls());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void replayWorksFromAFreshProcessView() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-replay-fresh-");
        try {
            PipelineRunner writer = runner(root, new CapabilityRegistry().registerAll(List.of(
                    RecordingCapability.failing("a", "boom"),
                    RecordingCapability.returning("b", value("chain end")))));
            PipelineRunner.RunOutcome outcome = writer.run(TestPipelines.chain(1_000L), Map.of(), "run-fresh");

            PipelineRunner reader = runner(root, new CapabilityRegistry());
            RunReplayer.ReplayOutcome replay = reader.replayer().replay("run-fresh");

            Assertions.assertEquals(outcome.output(), replay.output());
            Assertions.assertTrue(replay.digestMatches());
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void unknownOrEmptyRunIsNotFound() throws Exception {
        Path root = Files.createTempDirectory("stagerelay-test-replay-missing-");
        try {
            PipelineRunner runner = runner(root, new CapabilityRegistry());
            runner.store().insertRun(new RunRow("run-empty", "p", "ACTIVE", "t", "{}", "{}", "[]", null, null, 1L, 1L));

            RunNotFoundException missing = Assertions.assertThrows(RunNotFoundException.class,
                    () -> runner.replayer().replay("run-does-not-exist"));
            Assertions.assertEquals("run-does-not-exist", missing.runId());
            Assertions.assertThrows(RunNotFoundException.class, () -> runner.replayer().replay("run-empty"));
        } finally {
            TestPipelines.deleteRecursively(root);
        }
    }

    @Test
    void rebuildRefusesDuplicateTaskRecords() {
        RunLogRecord one = RunLogRecord.fromJson("{\"run_id\":\"r\",\"seq\":1,\"task_id\":\"t\",\"status\":\"SUCCESS\","
                + "\"provenance\":\"CAPABILITY\",\"payload\":{\"v\":1},\"attempts\":1}");
        RunLogRecord two = RunLogRecord.fromJson("{\"run_id\":\"r\",\"seq\":2,\"task_id\":\"t\",\"status\":\"SUCCESS\","
                + "\"provenance\":\"CAPABILITY\",\"payload\":{\"v\":2},\"attempts\":1}");

        Assertions.assertEquals(1, RunReplayer.rebuild(List.of(one)).size());
        Assertions.assertThrows(IllegalStateException.class, () -> RunReplayer.rebuild(List.of(one, two)));
    }

    private static PipelineRunner runner(Path root, CapabilityRegistry registry) {
        PipelineRunner runner = new PipelineRunner(StageRelayConfig.fromRoot(root.toString()), registry, ms -> {
        }, new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        runner.init();
        return runner;
    }
}
