package io.stagerelay.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagerelay.util.Jsons;
import io.stagerelay.validation.FieldRule;
import io.stagerelay.validation.FieldType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

// Copies key-identified entities from upstream outputs, then pads with unused reference companies.
public final class CarryForwardFallbackStrategy implements FallbackStrategy {
    public static final String NAME = "carry-forward";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ObjectNode synthesize(FallbackRequest request) {
        SchemaFiller filler = new SchemaFiller(request.task().id(), request.digest());
        ObjectNode out = Jsons.mapper().createObjectNode();
        for (FieldRule rule : request.task().output().fields()) {
            if (!rule.required() && rule.fallbackValue() == null) {
                continue;
            }
            List<FieldRule> keys = keyFields(rule);
            if (keys.isEmpty()) {
                out.set(rule.name(), filler.fillField(rule, rule.name()));
                continue;
            }
            List<JsonNode> entities = collectEntities(request, keys);
            ArrayNode items = Jsons.mapper().createArrayNode();
            Set<String> tickers = new HashSet<>();
            for (JsonNode entity : entities) {
                ObjectNode item = project(entity, rule.fields(), filler, rule.name() + "[" + items.size() + "]");
                for (FieldRule key : keys) {
                    filler.reserve(key.name(), item.path(key.name()).asText(null));
                }
                tickers.add(ReferenceUniverseFallbackStrategy.tickerOf(item, rule.fields()));
                items.add(item);
            }
            boolean companies = ReferenceUniverseFallbackStrategy.describesCompany(rule);
            Iterator<ReferenceUniverseFallbackStrategy.Company> spare =
                    ReferenceUniverseFallbackStrategy.ranked(request.digest()).iterator();
            while (items.size() < rule.effectiveMinItems()) {
                String path = rule.name() + "[" + items.size() + "]";
                ReferenceUniverseFallbackStrategy.Company next = companies ? nextUnused(spare, tickers) : null;
                if (next == null) {
                    items.add(filler.fillItem(rule, path));
                    continue;
                }
                tickers.add(next.ticker());
                ObjectNode item = ReferenceUniverseFallbackStrategy.companyItem(next, rule.fields(), filler, path);
                for (FieldRule key : keys) {
                    filler.reserve(key.name(), item.path(key.name()).asText(null));
                }
                items.add(item);
            }
            out.set(rule.name(), items);
        }
        return out;
    }

    private static ReferenceUniverseFallbackStrategy.Company nextUnused(
            Iterator<ReferenceUniverseFallbackStrategy.Company> spare, Set<String> tickers) {
        while (spare.hasNext()) {
            ReferenceUniverseFallbackStrategy.Company candidate = spare.next();
            if (!tickers.contains(candidate.ticker())) {
                return candidate;
            }
        }
        return null;
    }

    private static List<FieldRule> keyFields(FieldRule rule) {
        if (rule.type() != FieldType.ARRAY || rule.itemType() != FieldType.OBJECT) {
            return List.of();
        }
        return rule.fields().stream().filter(FieldRule::key).toList();
    }

    private static List<JsonNode> collectEntities(FallbackRequest request, List<FieldRule> keys) {
        Map<String, JsonNode> found = new LinkedHashMap<>();
        for (String dep : request.task().dependsOn()) {
            JsonNode node = request.upstream().get(dep);
            if (node != null) {
                scan(node, keys, found);
            }
        }
        return new ArrayList<>(found.values());
    }

    private static void scan(JsonNode node, List<FieldRule> keys, Map<String, JsonNode> found) {
        if (node.isObject()) {
            String identity = identity(node, keys);
            if (identity != null) {
                found.putIfAbsent(identity, node);
                return;
            }
            node.elements().forEachRemaining(child -> scan(child, keys, found));
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                scan(child, keys, found);
            }
        }
    }

    private static String identity(JsonNode node, List<FieldRule> keys) {
        StringBuilder sb = new StringBuilder();
        for (FieldRule key : keys) {
            JsonNode value = node.get(key.name());
            if (value == null || !value.isTextual() || value.asText().isBlank()) {
                return null;
            }
            if (key.pattern() != null && !Pattern.compile(key.pattern()).matcher(value.asText()).matches()) {
                return null;
            }
            sb.append(value.asText()).append('\u0000');
        }
        return sb.toString();
    }

    private static ObjectNode project(JsonNode entity, List<FieldRule> fields, SchemaFiller filler, String path) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        for (FieldRule field : fields) {
            JsonNode value = entity.get(field.name());
            if (value != null && compatible(value, field)) {
                out.set(field.name(), value.deepCopy());
            } else if (field.required() || field.fallbackValue() != null) {
                out.set(field.name(), filler.fillField(field, SchemaFiller.join(path, field.name())));
            }
        }
        return out;
    }

    private static boolean compatible(JsonNode value, FieldRule field) {
        return switch (field.type()) {
            case STRING -> value.isTextual() && !value.asText().isBlank()
                    && (field.pattern() == null || Pattern.compile(field.pattern()).matcher(value.asText()).matches());
            case NUMBER -> value.isNumber() && inRange(value.asDouble(), field);
            case INTEGER -> value.isIntegralNumber() && inRange(value.asDouble(), field);
            case BOOLEAN -> value.isBoolean();
            case OBJECT -> value.isObject() && !value.isEmpty() && field.fields().isEmpty();
            case ARRAY -> value.isArray() && value.size() >= field.effectiveMinItems() && field.fields().isEmpty();
        };
    }

    private static boolean inRange(double value, FieldRule field) {
        return (field.min() == null || value >= field.min()) && (field.max() == null || value <= field.max());
    }
}
