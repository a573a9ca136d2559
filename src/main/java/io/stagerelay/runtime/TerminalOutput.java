package io.stagerelay.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stagerelay.util.Hashing;
import io.stagerelay.util.Jsons;

import java.util.List;
import java.util.Map;

public final class TerminalOutput {
    private TerminalOutput() {
    }

    public static String render(String runId, List<String> sinks, Map<String, StageResult> results) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("run_id", runId);
        ObjectNode outputs = root.putObject("outputs");
        for (String sink : sinks) {
            StageResult result = results.get(sink);
            if (result == null) {
                continue;
            }
            ObjectNode entry = outputs.putObject(sink);
            entry.put("status", result.status().name());
            entry.put("provenance", result.provenance().name());
            entry.set("payload", result.payloadNode());
        }
        return Jsons.toCompactJson(root);
    }

    public static String digest(String rendered) {
        return Hashing.sha256Hex(rendered);
    }
}
