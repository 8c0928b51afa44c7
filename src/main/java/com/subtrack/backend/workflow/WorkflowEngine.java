package com.subtrack.backend.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subtrack.backend.config.WorkflowProperties;
import com.subtrack.backend.enums.RunStatus;
import com.subtrack.backend.exceptions.ResourceNotFoundException;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.models.workflow.WorkflowStep;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * WorkflowEngine
 *
 * Durable execution host for {@link Workflow} beans:
 * - Creates runs and dispatches them to the workflow executor
 * - Replays a run against its step log and records the outcome
 * - Resumes parked runs once their wake time arrives
 * - Recovers runs orphaned by a dead worker and purges old completed runs
 */
@Service
@Slf4j
public class WorkflowEngine {

    private final WorkflowStore store;
    private final Map<String, Workflow> workflows;
    private final TaskExecutor taskExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final WorkflowProperties properties;

    public WorkflowEngine(WorkflowStore store,
                          List<Workflow> workflows,
                          @Qualifier("workflowTaskExecutor") TaskExecutor taskExecutor,
                          ObjectMapper objectMapper,
                          Clock clock,
                          MeterRegistry meterRegistry,
                          WorkflowProperties properties) {
        this.store = store;
        this.workflows = workflows.stream()
                .collect(Collectors.toMap(Workflow::getName, Function.identity()));
        this.taskExecutor = taskExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    // =========================
    // TRIGGERING
    // =========================

    /**
     * Create a run and start it. When called inside a transaction the run is dispatched only
     * after commit, so the first execution sees the data the caller just wrote.
     */
    public WorkflowRun trigger(String workflowName, Object payload, int maxRetries) {
        if (!workflows.containsKey(workflowName)) {
            throw new IllegalArgumentException("Unknown workflow: " + workflowName);
        }

        OffsetDateTime now = now();
        WorkflowRun run = WorkflowRun.builder()
                .workflowName(workflowName)
                .payload(writePayload(payload))
                .status(RunStatus.PENDING)
                .wakeAt(now)
                .maxRetries(maxRetries)
                .createdAt(now)
                .updatedAt(now)
                .build();
        run = store.saveRun(run);

        Counter.builder("workflow.runs.started")
                .description("Number of workflow runs triggered")
                .tag("workflow", workflowName)
                .register(meterRegistry)
                .increment();

        log.info("Triggered workflow '{}' run {} with payload {}", workflowName, run.getId(), run.getPayload());

        Long runId = run.getId();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(runId);
                }
            });
        } else {
            dispatch(runId);
        }
        return run;
    }

    /**
     * Hand a run to the workflow executor. A rejected hand-off is left for the poller.
     */
    public void dispatch(Long runId) {
        try {
            taskExecutor.execute(() -> execute(runId));
        } catch (TaskRejectedException e) {
            log.warn("Executor rejected run {}, leaving it for the poller: {}", runId, e.getMessage());
        }
    }

    // =========================
    // EXECUTION
    // =========================

    /**
     * Execute a run if it is due and nobody else holds it
     */
    public void execute(Long runId) {
        if (!store.claim(runId, now())) {
            log.debug("Run {} is not due or is held by another worker", runId);
            return;
        }

        WorkflowRun run = store.findRun(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow run not found: " + runId));
        Workflow workflow = workflows.get(run.getWorkflowName());
        if (workflow == null) {
            markFailed(run, "Unknown workflow: " + run.getWorkflowName());
            return;
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome;

        DurableWorkflowContext context = new DurableWorkflowContext(
                run, store.findSteps(runId), store, objectMapper, clock, meterRegistry, properties.wakeTolerance());
        try {
            context.completeElapsedSleeps();
            workflow.execute(context);
            markCompleted(run);
            outcome = "completed";
        } catch (WorkflowSuspendedException e) {
            markSleeping(run, e.getWakeAt());
            outcome = "suspended";
        } catch (RuntimeException e) {
            log.error("Run {} of workflow '{}' failed: {}", runId, run.getWorkflowName(), e.getMessage(), e);
            outcome = handleFailure(run, e);
        }

        sample.stop(Timer.builder("workflow.execution.duration")
                .description("Time taken by one execution of a workflow run")
                .tag("workflow", run.getWorkflowName())
                .tag("outcome", outcome)
                .register(meterRegistry));
    }

    // =========================
    // HOUSEKEEPING
    // =========================

    /**
     * Dispatch every run whose wake time has arrived
     */
    public int resumeDueRuns() {
        List<WorkflowRun> dueRuns = store.findDueRuns(now());
        if (!dueRuns.isEmpty()) {
            log.info("Resuming {} due workflow runs", dueRuns.size());
        }
        for (WorkflowRun run : dueRuns) {
            dispatch(run.getId());
        }
        return dueRuns.size();
    }

    /**
     * Put runs that stopped making progress while RUNNING back in the queue. Steps that
     * completed before the worker died are not repeated.
     */
    public int recoverStuckRuns() {
        OffsetDateTime now = now();
        List<WorkflowRun> stuckRuns = store.findRunningNotUpdatedSince(now.minus(properties.stuckAfter()));
        for (WorkflowRun run : stuckRuns) {
            log.warn("Run {} has been RUNNING since {}, returning it to the queue", run.getId(), run.getUpdatedAt());
            run.setStatus(RunStatus.PENDING);
            run.setWakeAt(now);
            run.setUpdatedAt(now);
            store.saveRun(run);

            Counter.builder("workflow.runs.recovered")
                    .description("Number of stuck workflow runs returned to the queue")
                    .register(meterRegistry)
                    .increment();
        }
        return stuckRuns.size();
    }

    public int purgeCompletedRuns() {
        int deleted = store.deleteCompletedBefore(now().minus(properties.retention()));
        if (deleted > 0) {
            log.info("Purged {} completed workflow runs", deleted);
        }
        return deleted;
    }

    // =========================
    // QUERIES
    // =========================

    public WorkflowRun getRun(Long runId) {
        return store.findRun(runId)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow run not found: " + runId));
    }

    public List<WorkflowStep> getSteps(Long runId) {
        return store.findSteps(runId);
    }

    // =========================
    // STATE TRANSITIONS
    // =========================

    private void markCompleted(WorkflowRun run) {
        OffsetDateTime now = now();
        run.setStatus(RunStatus.COMPLETED);
        run.setWakeAt(null);
        run.setFailureReason(null);
        run.setCompletedAt(now);
        run.setUpdatedAt(now);
        store.saveRun(run);
        recordFinished(run);
        log.info("Run {} of workflow '{}' completed after {} steps",
                run.getId(), run.getWorkflowName(), run.getCompletedStepCount());
    }

    private void markSleeping(WorkflowRun run, OffsetDateTime wakeAt) {
        run.setStatus(RunStatus.SLEEPING);
        run.setWakeAt(wakeAt);
        run.setUpdatedAt(now());
        store.saveRun(run);
    }

    private String handleFailure(WorkflowRun run, RuntimeException e) {
        if (run.canRetry()) {
            OffsetDateTime now = now();
            run.setAttempt(run.getAttempt() + 1);
            run.setStatus(RunStatus.PENDING);
            run.setWakeAt(now.plus(properties.retryDelay()));
            run.setFailureReason(e.getMessage());
            run.setUpdatedAt(now);
            store.saveRun(run);
            log.info("Run {} will be retried at {} (attempt {} of {})",
                    run.getId(), run.getWakeAt(), run.getAttempt(), run.getMaxRetries());
            return "retrying";
        }
        markFailed(run, e.getMessage());
        return "failed";
    }

    private void markFailed(WorkflowRun run, String reason) {
        OffsetDateTime now = now();
        run.setStatus(RunStatus.FAILED);
        run.setWakeAt(null);
        run.setFailureReason(reason);
        run.setCompletedAt(now);
        run.setUpdatedAt(now);
        store.saveRun(run);
        recordFinished(run);
        log.error("Run {} of workflow '{}' marked as failed: {}", run.getId(), run.getWorkflowName(), reason);
    }

    private void recordFinished(WorkflowRun run) {
        Counter.builder("workflow.runs.finished")
                .description("Number of workflow runs that reached a terminal status")
                .tag("workflow", run.getWorkflowName())
                .tag("status", run.getStatus().name())
                .register(meterRegistry)
                .increment();
    }

    private String writePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Workflow payload is not serializable", e);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
