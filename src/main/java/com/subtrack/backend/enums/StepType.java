package com.subtrack.backend.enums;

public enum StepType {
    RUN,
    SLEEP
}
