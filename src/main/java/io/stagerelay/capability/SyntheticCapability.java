package io.stagerelay.capability;

import com.fasterxml.jackson.databind.JsonNode;
import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public final class SyntheticCapability implements Capability {
    public static final String BUNDLED_RESOURCE = "synthetic/responses.json";

    private final String kind;
    private final String response;

    public SyntheticCapability(String kind, String response) {
        this.kind = kind;
        this.response = response;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public CapabilityResult invoke(CapabilityRequest request) {
        return CapabilityResult.ok(response);
    }

    public static List<SyntheticCapability> bundled() {
        try (InputStream in = SyntheticCapability.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Synthetic response resource not found: " + BUNDLED_RESOURCE);
            }
            JsonNode root = Jsons.mapper().readTree(in);
            List<SyntheticCapability> out = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> it = root.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                out.add(new SyntheticCapability(entry.getKey(), Jsons.toJson(entry.getValue())));
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read synthetic responses", e);
        }
    }
}
