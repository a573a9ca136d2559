package io.stagerelay.fallback;

import com.fasterxml.jackson.databind.node.ObjectNode;

public final class SchemaFallbackStrategy implements FallbackStrategy {
    public static final String NAME = "schema";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ObjectNode synthesize(FallbackRequest request) {
        SchemaFiller filler = new SchemaFiller(request.task().id(), request.digest());
        return filler.fillObject(request.task().output().fields(), "");
    }
}
