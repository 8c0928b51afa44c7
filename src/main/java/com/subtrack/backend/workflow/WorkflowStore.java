package com.subtrack.backend.workflow;

import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.models.workflow.WorkflowStep;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for runs and their step logs.
 */
public interface WorkflowStore {

    WorkflowRun saveRun(WorkflowRun run);

    Optional<WorkflowRun> findRun(Long runId);

    /**
     * Atomically move a PENDING or SLEEPING run whose wake time has arrived to RUNNING.
     *
     * @return {@code true} if this caller now owns the run
     */
    boolean claim(Long runId, OffsetDateTime now);

    List<WorkflowRun> findDueRuns(OffsetDateTime now);

    List<WorkflowRun> findRunningNotUpdatedSince(OffsetDateTime cutoff);

    List<WorkflowStep> findSteps(Long runId);

    WorkflowStep saveStep(WorkflowStep step);

    /**
     * Delete COMPLETED runs finished before {@code cutoff}, with their steps.
     *
     * @return number of runs deleted
     */
    int deleteCompletedBefore(OffsetDateTime cutoff);
}
