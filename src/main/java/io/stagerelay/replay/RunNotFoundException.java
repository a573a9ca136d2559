package io.stagerelay.replay;

import io.stagerelay.PipelineException;

public final class RunNotFoundException extends PipelineException {
    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
