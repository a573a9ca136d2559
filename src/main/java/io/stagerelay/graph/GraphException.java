package io.stagerelay.graph;

import io.stagerelay.PipelineException;

public final class GraphException extends PipelineException {
    public GraphException(String message) {
        super(message);
    }
}
