package io.stagerelay.replay;

import io.stagerelay.runtime.RunStatus;
import io.stagerelay.runtime.StageResult;
import io.stagerelay.runtime.TerminalOutput;
import io.stagerelay.storage.RunLogRecord;
import io.stagerelay.storage.RunRow;
import io.stagerelay.storage.RunStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a run's terminal output from its log alone. No capability, validator
 * or fallback code is involved.
 */
public final class RunReplayer {
    private final RunStore store;

    public RunReplayer(RunStore store) {
        this.store = store;
    }

    public ReplayOutcome replay(String runId) {
        RunRow run = store.findRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        List<RunLogRecord> records = store.listRecords(runId);
        if (records.isEmpty()) {
            throw new RunNotFoundException(runId);
        }
        Map<String, StageResult> results = rebuild(records);
        String output = TerminalOutput.render(runId, run.sinks(), results);
        String digest = TerminalOutput.digest(output);
        List<String> missingSinks = run.sinks().stream().filter(s -> !results.containsKey(s)).toList();
        return new ReplayOutcome(
                runId,
                RunStatus.fromString(run.status()),
                output,
                digest,
                run.outputDigest(),
                run.outputDigest() != null && run.outputDigest().equals(digest),
                records.size(),
                missingSinks
        );
    }

    public static Map<String, StageResult> rebuild(List<RunLogRecord> records) {
        Map<String, StageResult> out = new LinkedHashMap<>();
        for (RunLogRecord record : records) {
            if (out.putIfAbsent(record.taskId(), record.toStageResult()) != null) {
                throw new IllegalStateException("Run log holds two records for task " + record.taskId());
            }
        }
        return out;
    }

    public record ReplayOutcome(
            String runId,
            RunStatus status,
            String output,
            String outputDigest,
            String recordedDigest,
            boolean digestMatches,
            int records,
            List<String> missingSinks
    ) {
    }
}
