package io.stagerelay.fallback;

import io.stagerelay.PipelineException;

public final class FallbackSynthesisException extends PipelineException {
    private final String taskId;

    public FallbackSynthesisException(String taskId, String message) {
        super("Fallback synthesis failed for task " + taskId + ": " + message);
        this.taskId = taskId;
    }

    public FallbackSynthesisException(String taskId, String message, Throwable cause) {
        super("Fallback synthesis failed for task " + taskId + ": " + message, cause);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
