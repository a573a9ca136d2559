package io.stagerelay.fallback;

import com.fasterxml.jackson.databind.node.ObjectNode;

public interface FallbackStrategy {
    String name();

    ObjectNode synthesize(FallbackRequest request);
}
