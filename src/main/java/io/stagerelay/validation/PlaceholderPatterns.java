package io.stagerelay.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class PlaceholderPatterns {
    public static final List<String> DEFAULTS = List.of(
            "\\b(?:Company|Stock|Corporation|Firm|Ticker|Symbol)\\s+[A-Z]\\b(?![a-z'])",
            "\\b(?:COMPANY|STOCK|TICKER)_[A-Z0-9]+\\b",
            "(?i)\\b(?:acme|xyz|abc)\\s+(?:corp|corporation|inc|company|ltd)\\b",
            "\\[(?i:company|ticker|symbol|name|sector)[^\\]]*\\]",
            "<(?i:company|ticker|symbol|name)[^>]*>",
            "\\{\\{[^}]*\\}\\}",
            "(?i)\\blorem ipsum\\b",
            "(?i)^\\s*(?:tbd|todo|n/?a|none|null|placeholder|unknown|xxx+|ticker|symbol|company name)\\s*$",
            "^(?:ABC|XYZ)$"
    );

    private PlaceholderPatterns() {
    }

    public static List<String> forPolicy(OutputPolicy policy) {
        List<String> out = new ArrayList<>();
        if (policy.placeholderDefaults()) {
            out.addAll(DEFAULTS);
        }
        out.addAll(policy.rejectPatterns());
        return out;
    }

    public static Optional<String> firstMatch(String value, List<Pattern> patterns) {
        if (value == null) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(value).find()) {
                return Optional.of(pattern.pattern());
            }
        }
        return Optional.empty();
    }

    public static Pattern compile(String raw) {
        try {
            return Pattern.compile(raw);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid pattern: " + raw, e);
        }
    }
}
