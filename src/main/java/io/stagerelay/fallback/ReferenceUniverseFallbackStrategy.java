package io.stagerelay.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagerelay.util.Hashing;
import io.stagerelay.util.Jsons;
import io.stagerelay.validation.FieldRule;
import io.stagerelay.validation.FieldType;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

// Ranking is a digest of the request, so it never differs between runs with the same inputs.
public final class ReferenceUniverseFallbackStrategy implements FallbackStrategy {
    public static final String NAME = "reference-universe";

    static final List<Company> REFERENCE = List.of(
            new Company("Microsoft Corporation", "MSFT", "Information Technology"),
            new Company("Apple Inc.", "AAPL", "Information Technology"),
            new Company("NVIDIA Corporation", "NVDA", "Information Technology"),
            new Company("Alphabet Inc.", "GOOGL", "Communication Services"),
            new Company("Amazon.com, Inc.", "AMZN", "Consumer Discretionary"),
            new Company("JPMorgan Chase & Co.", "JPM", "Financials"),
            new Company("Johnson & Johnson", "JNJ", "Health Care"),
            new Company("Exxon Mobil Corporation", "XOM", "Energy"),
            new Company("The Procter & Gamble Company", "PG", "Consumer Staples"),
            new Company("Visa Inc.", "V", "Financials"),
            new Company("UnitedHealth Group Incorporated", "UNH", "Health Care"),
            new Company("Costco Wholesale Corporation", "COST", "Consumer Staples")
    );

    private static final Set<String> NAME_FIELDS = Set.of("company_name", "company", "name");
    private static final Set<String> TICKER_FIELDS = Set.of("ticker", "symbol");
    private static final Set<String> SECTOR_FIELDS = Set.of("sector", "industry");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ObjectNode synthesize(FallbackRequest request) {
        String digest = request.digest();
        SchemaFiller filler = new SchemaFiller(request.task().id(), digest);
        List<Company> ranked = ranked(digest);
        ObjectNode out = Jsons.mapper().createObjectNode();
        for (FieldRule rule : request.task().output().fields()) {
            if (!rule.required() && rule.fallbackValue() == null) {
                continue;
            }
            if (rule.type() != FieldType.ARRAY || rule.itemType() != FieldType.OBJECT || !describesCompany(rule)) {
                out.set(rule.name(), filler.fillField(rule, rule.name()));
                continue;
            }
            int count = Math.min(ranked.size(), Math.max(rule.effectiveMinItems(), requestedSize(request)));
            ArrayNode items = Jsons.mapper().createArrayNode();
            for (int i = 0; i < count; i++) {
                items.add(companyItem(ranked.get(i), rule.fields(), filler, rule.name() + "[" + i + "]"));
            }
            while (items.size() < rule.effectiveMinItems()) {
                items.add(filler.fillItem(rule, rule.name() + "[" + items.size() + "]"));
            }
            out.set(rule.name(), items);
        }
        return out;
    }

    static List<Company> ranked(String digest) {
        return REFERENCE.stream()
                .sorted(Comparator.comparing((Company c) -> Hashing.sha256Hex(digest + "|" + c.ticker())))
                .toList();
    }

    static boolean describesCompany(FieldRule rule) {
        return rule.fields().stream().anyMatch(f -> TICKER_FIELDS.contains(f.name().toLowerCase(Locale.ROOT)));
    }

    private static int requestedSize(FallbackRequest request) {
        String raw = request.params().get("universe_size");
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static ObjectNode companyItem(Company company, List<FieldRule> fields, SchemaFiller filler, String path) {
        ObjectNode item = Jsons.mapper().createObjectNode();
        for (FieldRule field : fields) {
            String value = company.valueFor(field.name());
            if (value != null && field.type() == FieldType.STRING
                    && (field.pattern() == null || Pattern.compile(field.pattern()).matcher(value).matches())) {
                item.put(field.name(), value);
            } else if (field.required() || field.fallbackValue() != null) {
                item.set(field.name(), filler.fillField(field, SchemaFiller.join(path, field.name())));
            }
        }
        return item;
    }

    static String tickerOf(JsonNode item, List<FieldRule> fields) {
        for (FieldRule field : fields) {
            JsonNode value = item.get(field.name());
            if (TICKER_FIELDS.contains(field.name().toLowerCase(Locale.ROOT)) && value != null && value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }

    static List<String> candidateValues(List<Company> ranked, String field) {
        Set<String> out = new LinkedHashSet<>();
        for (Company company : ranked) {
            String own = company.valueFor(field);
            if (own != null) {
                out.add(own);
            }
        }
        for (Company company : ranked) {
            out.add(company.ticker());
        }
        for (Company company : ranked) {
            out.add(company.name());
        }
        for (Company company : ranked) {
            out.add(company.sector());
        }
        return List.copyOf(out);
    }

    record Company(String name, String ticker, String sector) {
        String valueFor(String field) {
            String lower = field.toLowerCase(Locale.ROOT);
            if (NAME_FIELDS.contains(lower)) {
                return name;
            }
            if (TICKER_FIELDS.contains(lower)) {
                return ticker;
            }
            if (SECTOR_FIELDS.contains(lower)) {
                return sector;
            }
            return null;
        }
    }
}
