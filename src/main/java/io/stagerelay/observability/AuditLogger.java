package io.stagerelay.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.security.SensitiveDataMasker;
import io.stagerelay.util.Hashing;
import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("result", event.result());
        row.put("trace_id", event.traceId());
        row.put("run_id", event.runId());
        row.put("task_id", event.taskId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public List<String> tail(int lines) {
        try {
            List<String> all = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            int n = Math.max(1, lines);
            return new ArrayList<>(all.subList(Math.max(0, all.size() - n), all.size()));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit tail", e);
        }
    }

    public static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.readTree(last).path("hash").asText("");
        } catch (IOException | IllegalArgumentException e) {
            // A torn last line starts a new chain rather than blocking every run.
            return "";
        }
    }

    private JsonNode sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(input));
    }

    public record AuditEvent(
            String action,
            String actor,
            String result,
            String traceId,
            String runId,
            String taskId,
            Map<String, Object> details
    ) {
        public static AuditEvent run(String action, String result, String traceId, String runId, Map<String, Object> details) {
            return new AuditEvent(action, "engine", result, traceId, runId, null, details == null ? Map.of() : details);
        }

        public static AuditEvent task(String action, String result, String traceId, String runId, String taskId,
                                      Map<String, Object> details) {
            return new AuditEvent(action, "engine", result, traceId, runId, taskId, details == null ? Map.of() : details);
        }
    }
}
