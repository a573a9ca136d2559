package io.stagerelay.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagerelay.util.Jsons;
import io.stagerelay.validation.FieldRule;
import io.stagerelay.validation.FieldType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

// Optional fields are left out; patterned strings fall back to reference-table values.
final class SchemaFiller {
    private static final String SAMPLE_DIGEST = "000000000000";

    private final String taskId;
    private final String reference;
    private final List<ReferenceUniverseFallbackStrategy.Company> ranked;
    private final Map<String, Set<String>> handedOut = new HashMap<>();

    SchemaFiller(String taskId, String digest) {
        this.taskId = taskId;
        this.reference = digest.length() > 12 ? digest.substring(0, 12) : digest;
        this.ranked = ReferenceUniverseFallbackStrategy.ranked(digest);
    }

    ObjectNode fillObject(List<FieldRule> rules, String path) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        for (FieldRule rule : rules) {
            if (!rule.required() && rule.fallbackValue() == null) {
                continue;
            }
            out.set(rule.name(), fillField(rule, join(path, rule.name())));
        }
        return out;
    }

    JsonNode fillField(FieldRule rule, String path) {
        if (rule.fallbackValue() != null && !rule.fallbackValue().isNull()) {
            return rule.fallbackValue().deepCopy();
        }
        if (rule.type() == FieldType.ARRAY) {
            ArrayNode array = Jsons.mapper().createArrayNode();
            for (int i = 0; i < rule.effectiveMinItems(); i++) {
                array.add(fillItem(rule, path + "[" + i + "]"));
            }
            return array;
        }
        return fillScalarOrObject(rule, rule.type(), path);
    }

    JsonNode fillItem(FieldRule arrayRule, String path) {
        return fillScalarOrObject(arrayRule, arrayRule.itemType(), path);
    }

    private JsonNode fillScalarOrObject(FieldRule rule, FieldType type, String path) {
        return switch (type) {
            case STRING -> Jsons.mapper().getNodeFactory().textNode(rule.pattern() == null
                    ? text(path)
                    : patterned(rule, path));
            case NUMBER -> Jsons.mapper().getNodeFactory().numberNode(clamp(0.0, rule.min(), rule.max()));
            case INTEGER -> Jsons.mapper().getNodeFactory().numberNode(
                    (long) Math.ceil(clamp(0.0, rule.min(), rule.max())));
            case BOOLEAN -> Jsons.mapper().getNodeFactory().booleanNode(false);
            case OBJECT -> {
                if (rule.fields().isEmpty()) {
                    ObjectNode note = Jsons.mapper().createObjectNode();
                    note.put("note", text(path));
                    yield note;
                }
                yield fillObject(rule.fields(), path);
            }
            case ARRAY -> {
                ArrayNode nested = Jsons.mapper().createArrayNode();
                nested.add(text(path + "[0]"));
                yield nested;
            }
        };
    }

    void reserve(String field, String value) {
        if (value != null) {
            handedOut.computeIfAbsent(field, k -> new HashSet<>()).add(value);
        }
    }

    private String patterned(FieldRule rule, String path) {
        Pattern pattern = Pattern.compile(rule.pattern());
        String generated = text(path);
        if (pattern.matcher(generated).matches()) {
            return generated;
        }
        Set<String> used = handedOut.computeIfAbsent(rule.name(), k -> new HashSet<>());
        String repeat = null;
        for (String candidate : ReferenceUniverseFallbackStrategy.candidateValues(ranked, rule.name())) {
            if (!pattern.matcher(candidate).matches()) {
                continue;
            }
            if (used.add(candidate)) {
                return candidate;
            }
            if (repeat == null) {
                repeat = candidate;
            }
        }
        return repeat != null ? repeat : generated;
    }

    static List<String> unsatisfiable(List<FieldRule> rules, String path) {
        List<String> problems = new ArrayList<>();
        SchemaFiller sample = new SchemaFiller("task", SAMPLE_DIGEST);
        collectUnsatisfiable(sample, rules, path, problems);
        return problems;
    }

    private static void collectUnsatisfiable(SchemaFiller sample, List<FieldRule> rules, String path, List<String> problems) {
        for (FieldRule rule : rules) {
            String fieldPath = join(path, rule.name());
            if (rule.fallbackValue() != null && !rule.fallbackValue().isNull()) {
                if (rule.pattern() != null && rule.fallbackValue().isTextual()
                        && !Pattern.compile(rule.pattern()).matcher(rule.fallbackValue().asText()).matches()) {
                    problems.add("fallbackValue of " + fieldPath + " does not match its pattern " + rule.pattern());
                }
                continue;
            }
            if (!rule.required()) {
                continue;
            }
            FieldType valueType = rule.type() == FieldType.ARRAY ? rule.itemType() : rule.type();
            if (valueType == FieldType.STRING && rule.pattern() != null) {
                Pattern pattern = Pattern.compile(rule.pattern());
                boolean reachable = pattern.matcher(sample.text(fieldPath)).matches()
                        || ReferenceUniverseFallbackStrategy.candidateValues(sample.ranked, rule.name()).stream()
                        .anyMatch(candidate -> pattern.matcher(candidate).matches());
                if (!reachable) {
                    problems.add(fieldPath + " has pattern " + rule.pattern()
                            + " that no synthesized value matches; declare a fallbackValue");
                }
            }
            collectUnsatisfiable(sample, rule.fields(), fieldPath, problems);
        }
    }

    String text(String path) {
        return "Unavailable: synthesized fallback for " + taskId + "." + path + " (ref " + reference + ")";
    }

    static String join(String path, String name) {
        return path == null || path.isEmpty() ? name : path + "." + name;
    }

    private static double clamp(double value, Double min, Double max) {
        double out = value;
        if (min != null && out < min) {
            out = min;
        }
        if (max != null && out > max) {
            out = max;
        }
        return out;
    }
}
