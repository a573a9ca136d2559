package io.stagerelay.validation;

import java.util.List;

public record OutputPolicy(
        List<FieldRule> fields,
        List<String> rejectPatterns,
        Boolean placeholderDefaults
) {
    public OutputPolicy {
        fields = fields == null ? List.of() : List.copyOf(fields);
        rejectPatterns = rejectPatterns == null ? List.of() : List.copyOf(rejectPatterns);
        if (placeholderDefaults == null) placeholderDefaults = true;
    }

    public static OutputPolicy of(FieldRule... fields) {
        return new OutputPolicy(List.of(fields), List.of(), true);
    }
}
