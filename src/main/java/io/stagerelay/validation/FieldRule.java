package io.stagerelay.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record FieldRule(
        String name,
        FieldType type,
        Boolean required,
        Integer minItems,
        String pattern,
        Double min,
        Double max,
        Boolean key,
        JsonNode fallbackValue,
        FieldType itemType,
        List<FieldRule> fields
) {
    public FieldRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name cannot be empty");
        }
        if (type == null) type = FieldType.STRING;
        if (required == null) required = true;
        if (key == null) key = false;
        if (fields == null) fields = List.of();
        fields = List.copyOf(fields);
        if (itemType == null) itemType = fields.isEmpty() ? FieldType.STRING : FieldType.OBJECT;
    }

    public static FieldRule string(String name) {
        return new FieldRule(name, FieldType.STRING, true, null, null, null, null, false, null, null, List.of());
    }

    public static FieldRule keyString(String name, String pattern) {
        return new FieldRule(name, FieldType.STRING, true, null, pattern, null, null, true, null, null, List.of());
    }

    public static FieldRule number(String name, Double min, Double max) {
        return new FieldRule(name, FieldType.NUMBER, true, null, null, min, max, false, null, null, List.of());
    }

    public static FieldRule objectArray(String name, int minItems, List<FieldRule> itemFields) {
        return new FieldRule(name, FieldType.ARRAY, true, minItems, null, null, null, false, null, FieldType.OBJECT, itemFields);
    }

    public int effectiveMinItems() {
        return minItems == null || minItems < 1 ? 1 : minItems;
    }
}
