package com.subtrack.backend.enums;

public enum StepStatus {
    COMPLETED,
    WAITING,
    FAILED;

    public boolean isCompleted() {
        return this == COMPLETED;
    }
}
