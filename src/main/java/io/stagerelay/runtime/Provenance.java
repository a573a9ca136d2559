package io.stagerelay.runtime;

public enum Provenance {
    CAPABILITY,
    FALLBACK
}
