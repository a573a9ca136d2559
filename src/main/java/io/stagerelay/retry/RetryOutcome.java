package io.stagerelay.retry;

import com.fasterxml.jackson.databind.JsonNode;

public record RetryOutcome(
        Status status,
        JsonNode output,
        int attempts,
        String lastError
) {
    public enum Status {
        SUCCEEDED,
        EXHAUSTED,
        CANCELLED
    }

    public static RetryOutcome succeeded(JsonNode output, int attempts) {
        return new RetryOutcome(Status.SUCCEEDED, output, attempts, null);
    }

    public static RetryOutcome exhausted(int attempts, String lastError) {
        return new RetryOutcome(Status.EXHAUSTED, null, attempts, lastError);
    }

    public static RetryOutcome cancelled(int attempts, String lastError) {
        return new RetryOutcome(Status.CANCELLED, null, attempts, lastError);
    }

    public RetryExhausted toExhausted(String taskId) {
        if (status != Status.EXHAUSTED) {
            throw new IllegalStateException("outcome is " + status + ", not EXHAUSTED");
        }
        return new RetryExhausted(taskId, attempts, lastError);
    }
}
