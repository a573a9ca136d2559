package io.stagerelay.config;

import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record PipelineSettings(
        int workerThreads,
        long defaultTimeoutMs,
        int defaultMaxAttempts,
        long baseBackoffMs,
        long maxBackoffMs
) {
    public static PipelineSettings defaults() {
        return new PipelineSettings(
                StageRelayConfig.DEFAULT_WORKER_THREADS,
                StageRelayConfig.DEFAULT_TASK_TIMEOUT_MS,
                StageRelayConfig.DEFAULT_MAX_ATTEMPTS,
                StageRelayConfig.DEFAULT_BASE_BACKOFF_MS,
                StageRelayConfig.DEFAULT_MAX_BACKOFF_MS
        );
    }

    public static PipelineSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static PipelineSettings fromFile(SettingsFile file, PipelineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int workers = sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1);
        long timeout = sanitizeLong(file.defaultTimeoutMs(), defaults.defaultTimeoutMs(), 1L);
        int attempts = sanitizeInt(file.defaultMaxAttempts(), defaults.defaultMaxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 0L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), 0L);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new PipelineSettings(workers, timeout, attempts, baseBackoff, maxBackoff);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    record SettingsFile(
            Integer workerThreads,
            Long defaultTimeoutMs,
            Integer defaultMaxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs
    ) {
    }
}
