package com.subtrack.backend.support;

import com.subtrack.backend.enums.RunStatus;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.models.workflow.WorkflowStep;
import com.subtrack.backend.workflow.WorkflowStore;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WorkflowStore over maps, with the same claim rules as the JPA store.
 */
public class InMemoryWorkflowStore implements WorkflowStore {

    private final Map<Long, WorkflowRun> runs = new LinkedHashMap<>();
    private final Map<Long, WorkflowStep> steps = new LinkedHashMap<>();
    private final AtomicLong runIds = new AtomicLong();
    private final AtomicLong stepIds = new AtomicLong();

    @Override
    public synchronized WorkflowRun saveRun(WorkflowRun run) {
        if (run.getId() == null) {
            run.setId(runIds.incrementAndGet());
        }
        runs.put(run.getId(), run);
        return run;
    }

    @Override
    public synchronized Optional<WorkflowRun> findRun(Long runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized boolean claim(Long runId, OffsetDateTime now) {
        WorkflowRun run = runs.get(runId);
        if (run == null || !run.getStatus().isResumable()) {
            return false;
        }
        if (run.getWakeAt() != null && run.getWakeAt().isAfter(now)) {
            return false;
        }
        run.setStatus(RunStatus.RUNNING);
        run.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized List<WorkflowRun> findDueRuns(OffsetDateTime now) {
        return runs.values().stream()
                .filter(run -> run.getStatus().isResumable())
                .filter(run -> run.getWakeAt() != null && !run.getWakeAt().isAfter(now))
                .sorted(Comparator.comparing(WorkflowRun::getWakeAt))
                .toList();
    }

    @Override
    public synchronized List<WorkflowRun> findRunningNotUpdatedSince(OffsetDateTime cutoff) {
        return runs.values().stream()
                .filter(run -> run.getStatus() == RunStatus.RUNNING)
                .filter(run -> run.getUpdatedAt().isBefore(cutoff))
                .toList();
    }

    @Override
    public synchronized List<WorkflowStep> findSteps(Long runId) {
        return steps.values().stream()
                .filter(step -> step.getRunId().equals(runId))
                .sorted(Comparator.comparing(WorkflowStep::getStepIndex))
                .toList();
    }

    @Override
    public synchronized WorkflowStep saveStep(WorkflowStep step) {
        if (step.getId() == null) {
            step.setId(stepIds.incrementAndGet());
        }
        steps.put(step.getId(), step);
        return step;
    }

    @Override
    public synchronized int deleteCompletedBefore(OffsetDateTime cutoff) {
        List<Long> finished = new ArrayList<>();
        for (WorkflowRun run : runs.values()) {
            if (run.getStatus() == RunStatus.COMPLETED && run.getCompletedAt().isBefore(cutoff)) {
                finished.add(run.getId());
            }
        }
        steps.values().removeIf(step -> finished.contains(step.getRunId()));
        finished.forEach(runs::remove);
        return finished.size();
    }

    public synchronized Optional<WorkflowStep> findStep(Long runId, String stepName) {
        return steps.values().stream()
                .filter(step -> step.getRunId().equals(runId) && step.getStepName().equals(stepName))
                .findFirst();
    }
}
