package io.stagerelay.retry;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.capability.CallError;
import io.stagerelay.validation.ValidationResult;

public record AttemptResult(
        JsonNode output,
        CallError callError,
        ValidationResult rejection
) {
    public static AttemptResult accepted(JsonNode output) {
        return new AttemptResult(output, null, null);
    }

    public static AttemptResult callFailed(CallError error) {
        return new AttemptResult(null, error, null);
    }

    public static AttemptResult rejected(ValidationResult rejection) {
        return new AttemptResult(null, null, rejection);
    }

    public boolean isAccepted() {
        return output != null;
    }

    public boolean isCancelled() {
        return callError != null && callError.kind() == CallError.Kind.CANCELLED;
    }

    public String error() {
        if (callError != null) {
            return "call error " + callError;
        }
        if (rejection != null) {
            return "validation error: " + rejection.message();
        }
        return null;
    }
}
