package io.stagerelay.runtime;

import java.util.EnumSet;
import java.util.Set;

public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FALLBACK_APPLIED,
    RECORDED,
    ABORTED;

    public boolean canTransitionTo(TaskState next) {
        return allowedNext().contains(next);
    }

    private Set<TaskState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, ABORTED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FALLBACK_APPLIED, ABORTED);
            case SUCCEEDED, FALLBACK_APPLIED -> EnumSet.of(RECORDED);
            case RECORDED, ABORTED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
