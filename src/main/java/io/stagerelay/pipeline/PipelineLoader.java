package io.stagerelay.pipeline;

import io.stagerelay.config.StageRelayConfig;
import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class PipelineLoader {
    private PipelineLoader() {
    }

    public static PipelineDefinition fromFile(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("Pipeline file not found: " + file);
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), PipelineDefinition.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read pipeline file: " + file + " (" + e.getMessage() + ")", e);
        }
    }

    public static PipelineDefinition fromJson(String json) {
        try {
            return Jsons.mapper().readValue(json, PipelineDefinition.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid pipeline definition: " + e.getMessage(), e);
        }
    }

    public static PipelineDefinition fromResource(String resource) {
        try (InputStream in = PipelineLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Pipeline resource not found: " + resource);
            }
            return Jsons.mapper().readValue(in, PipelineDefinition.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read pipeline resource: " + resource, e);
        }
    }

    public static PipelineDefinition bundled() {
        return fromResource(StageRelayConfig.DEFAULT_PIPELINE_RESOURCE);
    }

    public static PipelineDefinition load(String file) {
        if (file == null || file.isBlank()) {
            return bundled();
        }
        return fromFile(Path.of(file));
    }
}
