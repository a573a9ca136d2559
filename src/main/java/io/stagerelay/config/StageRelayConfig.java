package io.stagerelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class StageRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_PIPELINE_RESOURCE = "pipelines/equity-research.json";
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_TASK_TIMEOUT_MS = 120_000L;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;

    private final Path rootDir;

    public StageRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static StageRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new StageRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("stagerelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("stagerelay-settings.json");
    }

    public Path capabilitiesFile() {
        return rootDir.resolve("capabilities.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path outputsRoot() {
        return rootDir.resolve("outputs");
    }
}
