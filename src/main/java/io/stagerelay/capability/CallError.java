package io.stagerelay.capability;

public record CallError(Kind kind, String message) {
    public enum Kind {
        TIMEOUT,
        TRANSPORT,
        CAPABILITY,
        CANCELLED
    }

    public static CallError timeout(long timeoutMs) {
        return new CallError(Kind.TIMEOUT, "capability call timed out after " + timeoutMs + "ms");
    }

    public static CallError transport(String message) {
        return new CallError(Kind.TRANSPORT, message);
    }

    public static CallError capability(String message) {
        return new CallError(Kind.CAPABILITY, message == null || message.isBlank() ? "capability reported failure" : message);
    }

    public static CallError cancelled() {
        return new CallError(Kind.CANCELLED, "run cancelled");
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ": " + message;
    }
}
