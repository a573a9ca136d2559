package io.stagerelay.graph;

public record InputBinding(String name, String source, String pointer) {
    public static final String PARAMS = "params";

    public InputBinding {
        if (name == null || name.isBlank()) {
            throw new GraphException("input name cannot be empty");
        }
        if (source == null || source.isBlank()) {
            throw new GraphException("input source cannot be empty: " + name);
        }
        pointer = pointer == null ? "" : pointer.trim();
        if (!pointer.isEmpty() && !pointer.startsWith("/")) {
            throw new GraphException("input pointer must start with '/': " + name + " -> " + pointer);
        }
    }

    public static InputBinding parse(String name, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new GraphException("input expression cannot be empty: " + name);
        }
        String raw = expression.trim();
        int hash = raw.indexOf('#');
        if (hash < 0) {
            return new InputBinding(name, raw, "");
        }
        return new InputBinding(name, raw.substring(0, hash), raw.substring(hash + 1));
    }

    public boolean fromParams() {
        return PARAMS.equals(source);
    }
}
