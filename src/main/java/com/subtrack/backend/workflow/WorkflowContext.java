package com.subtrack.backend.workflow;

import java.time.OffsetDateTime;
import java.util.function.Supplier;

/**
 * Host primitives available to workflow code during one execution of a run.
 */
public interface WorkflowContext {

    Long getRunId();

    /**
     * Deserialize the payload the run was triggered with
     */
    <T> T requestPayload(Class<T> type);

    /**
     * Execute {@code action} once per run under {@code stepName}. When the step already
     * completed in an earlier execution its recorded result is returned and the action is not
     * invoked. A failure is recorded against the step and rethrown.
     */
    <T> T run(String stepName, Class<T> resultType, Supplier<T> action);

    void run(String stepName, Runnable action);

    /**
     * Park the run until {@code wakeAt}. Returns immediately when the time has already come,
     * otherwise unwinds the workflow with {@link WorkflowSuspendedException}.
     */
    void sleepUntil(String stepName, OffsetDateTime wakeAt);

    /**
     * When the run came out of sleep {@code stepName}. A sleep resumed within the host's wake
     * tolerance reports its due time, so poller latency never pushes the run past a day
     * boundary. A later resume reports the time it actually resumed. Without a completed sleep
     * of that name this is {@link #now()}.
     */
    OffsetDateTime wokenAt(String stepName);

    OffsetDateTime now();
}
