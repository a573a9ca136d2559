package io.stagerelay.retry;

import java.util.function.BooleanSupplier;
import java.util.function.IntFunction;

public final class RetryController {
    private final Sleeper sleeper;

    public RetryController(Sleeper sleeper) {
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public RetryOutcome execute(RetryPolicy policy,
                                IntFunction<AttemptResult> attempt,
                                BooleanSupplier cancelled,
                                AttemptListener listener) {
        String lastError = null;
        for (int n = 1; n <= policy.maxAttempts(); n++) {
            if (cancelled.getAsBoolean()) {
                return RetryOutcome.cancelled(n - 1, lastError);
            }
            AttemptResult result = attempt.apply(n);
            if (result.isAccepted()) {
                listener.onAttempt(n, result, 0L);
                return RetryOutcome.succeeded(result.output(), n);
            }
            lastError = result.error();
            if (result.isCancelled() || cancelled.getAsBoolean()) {
                listener.onAttempt(n, result, 0L);
                return RetryOutcome.cancelled(n, lastError);
            }
            long delay = n < policy.maxAttempts() ? policy.backoffMs(n) : 0L;
            listener.onAttempt(n, result, delay);
            if (delay > 0L) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return RetryOutcome.cancelled(n, lastError);
                }
            }
        }
        return RetryOutcome.exhausted(policy.maxAttempts(), lastError);
    }

    @FunctionalInterface
    public interface AttemptListener {
        AttemptListener NONE = (attempt, result, nextDelayMs) -> {
        };

        void onAttempt(int attempt, AttemptResult result, long nextDelayMs);
    }
}
