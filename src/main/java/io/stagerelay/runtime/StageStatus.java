package io.stagerelay.runtime;

public enum StageStatus {
    SUCCESS,
    FALLBACK_USED,
    FAILED
}
