package com.subtrack.backend.workflow;

/**
 * A resumable process driven by {@link WorkflowEngine}.
 * <p>
 * {@link #execute(WorkflowContext)} is replayed from the top every time the run resumes, so
 * every side effect has to go through {@link WorkflowContext#run} and every wait through
 * {@link WorkflowContext#sleepUntil}. Code outside those calls must be deterministic given
 * the recorded step results and the current time.
 */
public interface Workflow {

    String getName();

    void execute(WorkflowContext context);
}
