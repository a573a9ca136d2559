package io.stagerelay.capability;

import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public final class ScriptCapability implements Capability {
    private static final int MAX_ERROR_CHARS = 512;

    private final String kind;
    private final List<String> command;
    private final ExecutorService drains = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "stagerelay-script-drain");
        t.setDaemon(true);
        return t;
    });

    public ScriptCapability(String kind, List<String> command) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("script capability kind cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script capability command cannot be empty: " + kind);
        }
        this.kind = kind;
        this.command = List.copyOf(command);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public CapabilityResult invoke(CapabilityRequest request) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.environment().put("STAGERELAY_RUN_ID", request.runId());
        pb.environment().put("STAGERELAY_TASK_ID", request.taskId());
        pb.environment().put("STAGERELAY_ATTEMPT", Integer.toString(request.attempt()));
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return CapabilityResult.fail("script spawn failed: " + e.getMessage());
        }

        // both pipes are drained while the script runs; a full pipe would block it
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            byte[] input = Jsons.toCompactJson(request.input()).getBytes(StandardCharsets.UTF_8);
            process.getOutputStream().write(input);
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(Math.max(1L, request.timeoutMs()), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return CapabilityResult.fail("script timeout after " + Duration.ofMillis(request.timeoutMs()));
            }

            String output = stdout.join();
            if (process.exitValue() == 0) {
                return CapabilityResult.ok(output.strip());
            }
            String errors = stderr.join();
            return CapabilityResult.fail("script exit=" + process.exitValue()
                    + " stderr=" + truncate(errors) + " output=" + truncate(output));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException | CompletionException e) {
            process.destroyForcibly();
            return CapabilityResult.fail("script execution failed: " + e.getMessage());
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, drains);
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
