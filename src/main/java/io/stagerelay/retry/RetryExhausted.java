package io.stagerelay.retry;

public record RetryExhausted(String taskId, int attempts, String lastError) {
}
