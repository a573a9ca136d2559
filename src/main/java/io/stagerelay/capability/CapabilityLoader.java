package io.stagerelay.capability;

import io.stagerelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CapabilityLoader {
    private static final Pattern ENV_REF = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private CapabilityLoader() {
    }

    public static CapabilityRegistry load(Path file, Map<String, String> env) {
        CapabilityRegistry registry = new CapabilityRegistry();
        if (file == null || !Files.exists(file)) {
            return registry;
        }
        CapabilityFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), CapabilityFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load capability config: " + file, e);
        }
        if (parsed == null || parsed.capabilities() == null) {
            return registry;
        }
        List<SyntheticCapability> synthetic = null;
        for (CapabilitySpec spec : parsed.capabilities()) {
            if (spec == null || spec.kind() == null || spec.kind().isBlank()) {
                throw new IllegalArgumentException("Capability entry without kind in " + file);
            }
            String type = spec.type() == null ? "script" : spec.type().trim().toLowerCase(Locale.ROOT);
            switch (type) {
                case "script" -> registry.register(new ScriptCapability(spec.kind(), spec.command()));
                case "http" -> registry.register(new HttpCapability(spec.kind(), spec.url(), expandHeaders(spec.headers(), env)));
                case "synthetic" -> {
                    if (synthetic == null) {
                        synthetic = SyntheticCapability.bundled();
                    }
                    SyntheticCapability match = synthetic.stream()
                            .filter(c -> c.kind().equals(spec.kind()))
                            .findFirst()
                            .orElseThrow(() -> new IllegalArgumentException("No synthetic response for kind: " + spec.kind()));
                    registry.register(match);
                }
                default -> throw new IllegalArgumentException("Unknown capability type: " + spec.type() + " (kind " + spec.kind() + ")");
            }
        }
        return registry;
    }

    static Map<String, String> expandHeaders(Map<String, String> headers, Map<String, String> env) {
        Map<String, String> out = new LinkedHashMap<>();
        if (headers == null) {
            return out;
        }
        headers.forEach((name, value) -> out.put(name, expand(value, env)));
        return out;
    }

    static String expand(String value, Map<String, String> env) {
        if (value == null) {
            return "";
        }
        Matcher m = ENV_REF.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String resolved = env == null ? null : env.get(m.group(1));
            if (resolved == null) {
                throw new IllegalArgumentException("Environment variable not set: " + m.group(1));
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(resolved));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private record CapabilityFile(List<CapabilitySpec> capabilities) {
    }

    private record CapabilitySpec(String kind, String type, List<String> command, String url, Map<String, String> headers) {
    }
}
