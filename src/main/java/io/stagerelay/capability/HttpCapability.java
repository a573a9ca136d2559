package io.stagerelay.capability;

import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

public final class HttpCapability implements Capability {
    private static final int MAX_ERROR_CHARS = 512;

    private final String kind;
    private final URI endpoint;
    private final Map<String, String> headers;
    private final HttpClient client;

    public HttpCapability(String kind, String url, Map<String, String> headers) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("http capability kind cannot be empty");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("http capability url cannot be empty: " + kind);
        }
        this.kind = kind;
        this.endpoint = URI.create(url.trim());
        this.headers = headers == null ? Map.of() : Map.copyOf(headers);
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public CapabilityResult invoke(CapabilityRequest request) throws InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofMillis(Math.max(1L, request.timeoutMs())))
                .header("Content-Type", "application/json")
                .header("X-StageRelay-Run-Id", request.runId())
                .header("X-StageRelay-Task-Id", request.taskId())
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(request.input()), StandardCharsets.UTF_8));
        headers.forEach(builder::header);
        try {
            HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() / 100 == 2) {
                return CapabilityResult.ok(response.body());
            }
            return CapabilityResult.fail("http status=" + response.statusCode() + " body=" + truncate(response.body()));
        } catch (IOException e) {
            return CapabilityResult.fail("http call failed: " + e.getMessage());
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        return normalized.length() <= MAX_ERROR_CHARS ? normalized : normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
