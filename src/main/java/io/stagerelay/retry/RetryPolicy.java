package io.stagerelay.retry;

/**
 * @param maxAttempts total invocations allowed, including the first
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseBackoffMs < 0 || maxBackoffMs < 0) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (maxBackoffMs < baseBackoffMs) {
            maxBackoffMs = baseBackoffMs;
        }
    }

    public long backoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        return Math.min(backoff, maxBackoffMs);
    }
}
