package io.stagerelay.runtime;

import java.util.Locale;

public enum RunStatus {
    ACTIVE,
    COMPLETE,
    ABORTED;

    public static RunStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        return RunStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
