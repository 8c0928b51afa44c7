package com.subtrack.backend.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subtrack.backend.enums.StepStatus;
import com.subtrack.backend.enums.StepType;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.models.workflow.WorkflowStep;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link WorkflowContext} backed by the run's persisted step log.
 * <p>
 * Created by {@link WorkflowEngine} for a single execution of a claimed run and discarded
 * afterwards. Every step outcome is written through the {@link WorkflowStore} as soon as it
 * happens, so a crash loses at most the step that was in flight.
 */
@Slf4j
public class DurableWorkflowContext implements WorkflowContext {

    private final WorkflowRun run;
    private final WorkflowStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Duration wakeTolerance;
    private final Map<String, WorkflowStep> stepsByName = new LinkedHashMap<>();

    public DurableWorkflowContext(WorkflowRun run,
                                  List<WorkflowStep> recordedSteps,
                                  WorkflowStore store,
                                  ObjectMapper objectMapper,
                                  Clock clock,
                                  MeterRegistry meterRegistry,
                                  Duration wakeTolerance) {
        this.run = run;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.wakeTolerance = wakeTolerance;
        for (WorkflowStep step : recordedSteps) {
            stepsByName.put(step.getStepName(), step);
        }
    }

    @Override
    public Long getRunId() {
        return run.getId();
    }

    @Override
    public <T> T requestPayload(Class<T> type) {
        return readJson(run.getPayload(), type);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    /**
     * Resuming a parked run is what ends its wait: every WAITING sleep whose time has arrived
     * is marked completed before the workflow is replayed.
     *
     * @return number of sleeps completed
     */
    public int completeElapsedSleeps() {
        OffsetDateTime now = now();
        int completed = 0;
        for (WorkflowStep step : stepsByName.values()) {
            if (step.getStatus() == StepStatus.WAITING && !step.getWakeAt().isAfter(now)) {
                markCompleted(step, null, now);
                log.info("Run {} resumed from '{}' (due {})", run.getId(), step.getStepName(), step.getWakeAt());
                completed++;
            }
        }
        return completed;
    }

    @Override
    public <T> T run(String stepName, Class<T> resultType, Supplier<T> action) {
        WorkflowStep existing = stepsByName.get(stepName);
        if (existing != null && existing.isCompleted()) {
            log.debug("Run {} replaying recorded step '{}'", run.getId(), stepName);
            return readJson(existing.getOutput(), resultType);
        }
        WorkflowStep step = existing != null ? requireType(existing, StepType.RUN) : newStep(stepName, StepType.RUN);

        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            step.setStatus(StepStatus.FAILED);
            step.setErrorMessage(e.getMessage());
            save(step);
            log.warn("Run {} step '{}' failed: {}", run.getId(), stepName, e.getMessage());
            throw e;
        }

        markCompleted(step, writeJson(result), now());
        return result;
    }

    @Override
    public void run(String stepName, Runnable action) {
        run(stepName, Void.class, () -> {
            action.run();
            return null;
        });
    }

    @Override
    public void sleepUntil(String stepName, OffsetDateTime wakeAt) {
        WorkflowStep existing = stepsByName.get(stepName);
        if (existing != null && existing.isCompleted()) {
            return;
        }
        WorkflowStep step = existing != null ? requireType(existing, StepType.SLEEP) : newStep(stepName, StepType.SLEEP);
        step.setWakeAt(wakeAt);

        OffsetDateTime now = now();
        if (!wakeAt.isAfter(now)) {
            markCompleted(step, null, now);
            return;
        }

        step.setStatus(StepStatus.WAITING);
        save(step);
        run.setWakeAt(wakeAt);
        log.info("Run {} suspended at '{}' until {}", run.getId(), stepName, wakeAt);
        throw new WorkflowSuspendedException(stepName, wakeAt);
    }

    @Override
    public OffsetDateTime wokenAt(String stepName) {
        WorkflowStep step = stepsByName.get(stepName);
        if (step == null || step.getStepType() != StepType.SLEEP || !step.isCompleted() || step.getCompletedAt() == null) {
            return now();
        }
        OffsetDateTime resumedAt = step.getCompletedAt();
        return resumedAt.isAfter(step.getWakeAt().plus(wakeTolerance)) ? resumedAt : step.getWakeAt();
    }

    private WorkflowStep newStep(String stepName, StepType type) {
        WorkflowStep step = WorkflowStep.builder()
                .runId(run.getId())
                .stepName(stepName)
                .stepIndex(stepsByName.size())
                .stepType(type)
                .createdAt(now())
                .build();
        stepsByName.put(stepName, step);
        return step;
    }

    private WorkflowStep requireType(WorkflowStep step, StepType expected) {
        if (step.getStepType() != expected) {
            throw new IllegalStateException("Step '" + step.getStepName() + "' of run " + run.getId()
                    + " was recorded as " + step.getStepType() + " but replayed as " + expected);
        }
        return step;
    }

    private void markCompleted(WorkflowStep step, String output, OffsetDateTime now) {
        step.setStatus(StepStatus.COMPLETED);
        step.setOutput(output);
        step.setErrorMessage(null);
        step.setCompletedAt(now);
        save(step);
        run.setCompletedStepCount(run.getCompletedStepCount() + 1);
        run.setUpdatedAt(now);
        store.saveRun(run);

        Counter.builder("workflow.steps.executed")
                .description("Number of workflow steps completed")
                .tag("workflow", run.getWorkflowName())
                .tag("type", step.getStepType().name())
                .register(meterRegistry)
                .increment();
    }

    private void save(WorkflowStep step) {
        WorkflowStep saved = store.saveStep(step);
        stepsByName.put(saved.getStepName(), saved);
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot record step result of run " + run.getId(), e);
        }
    }

    private <T> T readJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read recorded data of run " + run.getId() + " as " + type.getSimpleName(), e);
        }
    }
}
