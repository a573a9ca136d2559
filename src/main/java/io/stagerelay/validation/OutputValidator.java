package io.stagerelay.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

public final class OutputValidator {
    private static final int MAX_VIOLATIONS = 16;

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public ValidationResult validate(String rawPayload, OutputPolicy policy) {
        if (rawPayload == null || rawPayload.isBlank()) {
            return ValidationResult.rejected("payload is empty");
        }
        JsonNode parsed;
        try {
            parsed = Jsons.readTree(extractJson(rawPayload));
        } catch (IllegalArgumentException e) {
            return ValidationResult.rejected("payload is not valid JSON: " + e.getMessage());
        }
        return validateNode(parsed, policy);
    }

    public ValidationResult validateNode(JsonNode payload, OutputPolicy policy) {
        if (payload == null || !payload.isObject()) {
            return ValidationResult.rejected("payload must be a JSON object");
        }
        List<String> violations = new ArrayList<>();
        checkFields(payload, policy.fields(), "", violations);
        scanPlaceholders(payload, "", placeholderPatterns(policy), violations);
        if (!violations.isEmpty()) {
            return ValidationResult.rejected(violations.size() > MAX_VIOLATIONS
                    ? violations.subList(0, MAX_VIOLATIONS)
                    : violations);
        }
        return ValidationResult.accepted(payload);
    }

    public void checkPolicy(OutputPolicy policy) {
        placeholderPatterns(policy);
        checkFieldPatterns(policy.fields());
    }

    private void checkFieldPatterns(List<FieldRule> rules) {
        for (FieldRule rule : rules) {
            if (rule.pattern() != null) {
                pattern(rule.pattern());
            }
            checkFieldPatterns(rule.fields());
        }
    }

    private List<Pattern> placeholderPatterns(OutputPolicy policy) {
        List<Pattern> out = new ArrayList<>();
        for (String raw : PlaceholderPatterns.forPolicy(policy)) {
            out.add(pattern(raw));
        }
        return out;
    }

    private Pattern pattern(String raw) {
        Pattern cached = compiled.get(raw);
        if (cached != null) {
            return cached;
        }
        Pattern fresh = PlaceholderPatterns.compile(raw);
        compiled.putIfAbsent(raw, fresh);
        return fresh;
    }

    static String extractJson(String raw) {
        String text = raw.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            int closing = text.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                text = text.substring(firstNewline + 1, closing).strip();
            }
        }
        if (!text.startsWith("{")) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                text = text.substring(start, end + 1);
            }
        }
        return text;
    }

    private void checkFields(JsonNode node, List<FieldRule> rules, String prefix, List<String> violations) {
        for (FieldRule rule : rules) {
            String path = prefix.isEmpty() ? rule.name() : prefix + "." + rule.name();
            JsonNode value = node.get(rule.name());
            if (value == null || value.isNull() || value.isMissingNode()) {
                if (rule.required()) {
                    violations.add("missing required field: " + path);
                }
                continue;
            }
            checkValue(value, rule, rule.type(), path, violations);
        }
    }

    private void checkValue(JsonNode value, FieldRule rule, FieldType type, String path, List<String> violations) {
        switch (type) {
            case STRING -> {
                if (!value.isTextual()) {
                    violations.add(path + " must be a string");
                    return;
                }
                String text = value.asText();
                if (text.isBlank()) {
                    violations.add(path + " must not be empty");
                    return;
                }
                if (rule.pattern() != null && !pattern(rule.pattern()).matcher(text).matches()) {
                    violations.add(path + " does not match pattern " + rule.pattern());
                }
            }
            case NUMBER, INTEGER -> {
                if (!value.isNumber() || (type == FieldType.INTEGER && !value.isIntegralNumber())) {
                    violations.add(path + " must be " + (type == FieldType.INTEGER ? "an integer" : "a number"));
                    return;
                }
                double number = value.asDouble();
                if (rule.min() != null && number < rule.min()) {
                    violations.add(path + " must be >= " + rule.min());
                }
                if (rule.max() != null && number > rule.max()) {
                    violations.add(path + " must be <= " + rule.max());
                }
            }
            case BOOLEAN -> {
                if (!value.isBoolean()) {
                    violations.add(path + " must be a boolean");
                }
            }
            case OBJECT -> {
                if (!value.isObject()) {
                    violations.add(path + " must be an object");
                    return;
                }
                if (value.isEmpty()) {
                    violations.add(path + " must not be empty");
                    return;
                }
                checkFields(value, rule.fields(), path, violations);
            }
            case ARRAY -> {
                if (!value.isArray()) {
                    violations.add(path + " must be an array");
                    return;
                }
                if (value.size() < rule.effectiveMinItems()) {
                    violations.add(path + " needs at least " + rule.effectiveMinItems() + " item(s), got " + value.size());
                }
                for (int i = 0; i < value.size(); i++) {
                    checkValue(value.get(i), rule, rule.itemType(), path + "[" + i + "]", violations);
                }
            }
        }
    }

    private void scanPlaceholders(JsonNode node, String path, List<Pattern> patterns, List<String> violations) {
        if (node.isTextual()) {
            Optional<String> hit = PlaceholderPatterns.firstMatch(node.asText(), patterns);
            hit.ifPresent(pattern -> violations.add(
                    "placeholder value at " + (path.isEmpty() ? "$" : path) + ": \"" + abbreviate(node.asText()) + "\""));
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                scanPlaceholders(entry.getValue(), path.isEmpty() ? entry.getKey() : path + "." + entry.getKey(), patterns, violations);
            }
            return;
        }
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                scanPlaceholders(node.get(i), path + "[" + i + "]", patterns, violations);
            }
        }
    }

    private static String abbreviate(String value) {
        return value.length() <= 48 ? value : value.substring(0, 48) + "...";
    }
}
