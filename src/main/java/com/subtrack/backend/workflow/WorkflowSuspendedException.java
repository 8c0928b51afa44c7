package com.subtrack.backend.workflow;

import java.time.OffsetDateTime;

/**
 * Control-flow signal thrown by {@link WorkflowContext#sleepUntil} to unwind workflow code
 * when a run parks. Caught by {@link WorkflowEngine}; never an error.
 */
public class WorkflowSuspendedException extends RuntimeException {

    private final String stepName;
    private final OffsetDateTime wakeAt;

    public WorkflowSuspendedException(String stepName, OffsetDateTime wakeAt) {
        super("Suspended at step '" + stepName + "' until " + wakeAt, null, false, false);
        this.stepName = stepName;
        this.wakeAt = wakeAt;
    }

    public String getStepName() {
        return stepName;
    }

    public OffsetDateTime getWakeAt() {
        return wakeAt;
    }
}
