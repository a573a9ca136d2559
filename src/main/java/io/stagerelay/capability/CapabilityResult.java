package io.stagerelay.capability;

public record CapabilityResult(
        boolean success,
        String output,
        String error
) {
    public static CapabilityResult ok(String output) {
        return new CapabilityResult(true, output, null);
    }

    public static CapabilityResult fail(String error) {
        return new CapabilityResult(false, null, error);
    }
}
