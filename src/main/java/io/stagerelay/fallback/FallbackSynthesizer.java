package io.stagerelay.fallback;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagerelay.graph.TaskSpec;
import io.stagerelay.util.Jsons;
import io.stagerelay.validation.OutputPolicy;
import io.stagerelay.validation.OutputValidator;
import io.stagerelay.validation.ValidationResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class FallbackSynthesizer {
    private final Map<String, FallbackStrategy> strategies = new LinkedHashMap<>();
    private final Map<String, String> strategyByKind = new LinkedHashMap<>();
    private final OutputValidator validator;

    public FallbackSynthesizer(OutputValidator validator) {
        this.validator = validator;
        register(new SchemaFallbackStrategy());
    }

    public static FallbackSynthesizer standard(OutputValidator validator) {
        FallbackSynthesizer synthesizer = new FallbackSynthesizer(validator)
                .register(new CarryForwardFallbackStrategy())
                .register(new ReferenceUniverseFallbackStrategy());
        synthesizer.bindKind("market-screen", ReferenceUniverseFallbackStrategy.NAME);
        for (String kind : List.of("fundamental-analysis", "sentiment-analysis", "integrated-analysis", "investment-thesis")) {
            synthesizer.bindKind(kind, CarryForwardFallbackStrategy.NAME);
        }
        return synthesizer;
    }

    public FallbackSynthesizer register(FallbackStrategy strategy) {
        strategies.put(strategy.name(), strategy);
        return this;
    }

    public FallbackSynthesizer bindKind(String kind, String strategyName) {
        if (!strategies.containsKey(strategyName)) {
            throw new IllegalArgumentException("Unknown fallback strategy: " + strategyName);
        }
        strategyByKind.put(kind, strategyName);
        return this;
    }

    public boolean hasStrategy(String name) {
        return strategies.containsKey(name);
    }

    public FallbackStrategy strategyFor(TaskSpec task) {
        String name = task.fallback() != null && !task.fallback().isBlank()
                ? task.fallback()
                : strategyByKind.getOrDefault(task.kind(), SchemaFallbackStrategy.NAME);
        FallbackStrategy strategy = strategies.get(name);
        if (strategy == null) {
            throw new FallbackSynthesisException(task.id(), "unknown fallback strategy " + name);
        }
        return strategy;
    }

    public void checkSynthesizable(OutputPolicy policy) {
        List<String> problems = SchemaFiller.unsatisfiable(policy.fields(), "");
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", problems));
        }
    }

    /**
     * @return canonical (key-sorted) payload accepted by the task's output policy
     * @throws FallbackSynthesisException when the strategy fails or its output is rejected
     */
    public JsonNode synthesize(FallbackRequest request) {
        TaskSpec task = request.task();
        FallbackStrategy strategy = strategyFor(task);
        ObjectNode produced;
        try {
            produced = strategy.synthesize(request);
        } catch (RuntimeException e) {
            throw new FallbackSynthesisException(task.id(), strategy.name() + " strategy failed: " + e.getMessage(), e);
        }
        if (produced == null) {
            throw new FallbackSynthesisException(task.id(), strategy.name() + " strategy returned nothing");
        }
        JsonNode canonical = Jsons.sorted(produced);
        ValidationResult verdict = validator.validateNode(canonical, task.output());
        if (!verdict.valid()) {
            throw new FallbackSynthesisException(task.id(),
                    strategy.name() + " output violates the output policy: " + verdict.message());
        }
        return canonical;
    }
}
