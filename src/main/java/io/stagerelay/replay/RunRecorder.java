package io.stagerelay.replay;

import io.stagerelay.runtime.Run;
import io.stagerelay.runtime.StageResult;
import io.stagerelay.storage.RunLogRecord;
import io.stagerelay.storage.RunStore;

import java.time.Instant;

/**
 * Write-ahead recording of task results: the log row is committed before the
 * result becomes visible in the {@link Run}, so no dependent can observe a result
 * that a later replay would not see.
 */
public final class RunRecorder {
    private final RunStore store;

    public RunRecorder(RunStore store) {
        this.store = store;
    }

    public RunLogRecord record(Run run, StageResult result) {
        synchronized (run) {
            if (run.hasResult(result.taskId())) {
                throw new IllegalStateException("Result already written for task " + result.taskId());
            }
            RunLogRecord record = store.appendRecord(run.runId(), result, Instant.now().toEpochMilli());
            run.putResult(result);
            return record;
        }
    }
}
