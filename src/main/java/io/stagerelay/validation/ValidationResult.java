package io.stagerelay.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record ValidationResult(
        boolean valid,
        JsonNode output,
        List<String> violations
) {
    public static ValidationResult accepted(JsonNode output) {
        return new ValidationResult(true, output, List.of());
    }

    public static ValidationResult rejected(List<String> violations) {
        return new ValidationResult(false, null, List.copyOf(violations));
    }

    public static ValidationResult rejected(String violation) {
        return rejected(List.of(violation));
    }

    public String message() {
        return valid ? "ok" : String.join("; ", violations);
    }
}
