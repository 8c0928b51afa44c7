package com.subtrack.backend.enums;

public enum RunStatus {
    PENDING,
    RUNNING,
    SLEEPING,
    COMPLETED,
    FAILED;

    /**
     * A run in one of these states may be picked up by a worker once its wake time has arrived.
     */
    public boolean isResumable() {
        return this == PENDING || this == SLEEPING;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
