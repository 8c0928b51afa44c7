package com.subtrack.backend.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.subtrack.backend.config.WorkflowProperties;
import com.subtrack.backend.enums.RunStatus;
import com.subtrack.backend.enums.StepStatus;
import com.subtrack.backend.exceptions.ResourceNotFoundException;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.support.InMemoryWorkflowStore;
import com.subtrack.backend.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;

class WorkflowEngineTest {

    private static final OffsetDateTime WAKE_AT = OffsetDateTime.parse("2024-02-02T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final MeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final WorkflowProperties properties =
            new WorkflowProperties(Duration.ofMinutes(1), Duration.ofMinutes(15), Duration.ofDays(30), Duration.ofMinutes(5));

    private MutableClock clock;
    private InMemoryWorkflowStore store;
    private final List<Runnable> queued = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-02-01T10:00:00Z");
        store = new InMemoryWorkflowStore();
    }

    private WorkflowEngine engine(TaskExecutor executor, Workflow... workflows) {
        return new WorkflowEngine(store, List.of(workflows), executor, objectMapper, clock, meterRegistry, properties);
    }

    private WorkflowEngine syncEngine(Workflow... workflows) {
        return engine(Runnable::run, workflows);
    }

    @Test
    void trigger_runsWorkflowToCompletion() {
        AtomicInteger calls = new AtomicInteger();
        WorkflowEngine engine = syncEngine(new ScriptedWorkflow("simple",
                ctx -> ctx.run("only step", calls::incrementAndGet)));

        WorkflowRun run = engine.trigger("simple", Map.of("key", "value"), 0);

        WorkflowRun stored = engine.getRun(run.getId());
        assertThat(stored.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(stored.getCompletedAt()).isEqualTo(clock.now());
        assertThat(stored.getPayload()).isEqualTo("{\"key\":\"value\"}");
        assertThat(calls).hasValue(1);
        assertThat(meterRegistry.counter("workflow.runs.started", "workflow", "simple").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("workflow.runs.finished", "workflow", "simple", "status", "COMPLETED").count())
                .isEqualTo(1.0);
    }

    @Test
    void trigger_unknownWorkflowIsRejected() {
        WorkflowEngine engine = syncEngine(new ScriptedWorkflow("simple", ctx -> { }));

        assertThatThrownBy(() -> engine.trigger("missing", Map.of(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void sleepingRunIsResumedByPollerOnlyOnceDue() {
        List<String> log = new ArrayList<>();
        WorkflowEngine engine = syncEngine(new ScriptedWorkflow("sleepy", ctx -> {
            ctx.run("before", () -> log.add("before"));
            ctx.sleepUntil("wait a day", WAKE_AT);
            ctx.run("after", () -> log.add("after"));
        }));

        WorkflowRun run = engine.trigger("sleepy", Map.of(), 0);
        assertThat(engine.getRun(run.getId()).getStatus()).isEqualTo(RunStatus.SLEEPING);
        assertThat(engine.getRun(run.getId()).getWakeAt()).isEqualTo(WAKE_AT);

        clock.advance(Duration.ofHours(12));
        assertThat(engine.resumeDueRuns()).isZero();

        clock.set("2024-02-02T10:00:30Z");
        assertThat(engine.resumeDueRuns()).isEqualTo(1);

        assertThat(engine.getRun(run.getId()).getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(log).containsExactly("before", "after");
        assertThat(engine.getSteps(run.getId()))
                .extracting(step -> step.getStepName())
                .containsExactly("before", "wait a day", "after");
    }

    @Test
    void failingStepFailsRunWhenNoRetriesAllowed() {
        List<String> sent = new ArrayList<>();
        WorkflowEngine engine = syncEngine(new ScriptedWorkflow("mailer", ctx -> {
            ctx.run("first", () -> sent.add("first"));
            ctx.run("second", () -> {
                throw new IllegalStateException("provider unavailable");
            });
        }));

        WorkflowRun run = engine.trigger("mailer", Map.of(), 0);

        WorkflowRun stored = engine.getRun(run.getId());
        assertThat(stored.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(stored.getFailureReason()).isEqualTo("provider unavailable");
        assertThat(sent).containsExactly("first");
        assertThat(store.findStep(run.getId(), "first").orElseThrow().getStatus()).isEqualTo(StepStatus.COMPLETED);
        assertThat(store.findStep(run.getId(), "second").orElseThrow().getStatus()).isEqualTo(StepStatus.FAILED);

        // a failed run is never picked up again
        clock.advance(Duration.ofDays(1));
        assertThat(engine.resumeDueRuns()).isZero();
    }

    @Test
    void retryReExecutesOnlyTheFailedStep() {
        AtomicInteger firstCalls = new AtomicInteger();
        AtomicInteger secondCalls = new AtomicInteger();
        WorkflowEngine engine = syncEngine(new ScriptedWorkflow("flaky", ctx -> {
            ctx.run("first", firstCalls::incrementAndGet);
            ctx.run("second", () -> {
                if (secondCalls.incrementAndGet() == 1) {
                    throw new IllegalStateException("transient");
                }
            });
        }));

        WorkflowRun run = engine.trigger("flaky", Map.of(), 2);

        WorkflowRun pending = engine.getRun(run.getId());
        assertThat(pending.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(pending.getAttempt()).isEqualTo(1);
        assertThat(pending.getWakeAt()).isEqualTo(clock.now().plusMinutes(1));

        clock.advance(Duration.ofMinutes(1));
        engine.resumeDueRuns();

        assertThat(engine.getRun(run.getId()).getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(firstCalls).hasValue(1);
        assertThat(secondCalls).hasValue(2);
    }

    @Test
    void claimedRunIsNotExecutedTwice() {
        AtomicInteger calls = new AtomicInteger();
        WorkflowEngine engine = engine(queued::add, new ScriptedWorkflow("once",
                ctx -> ctx.run("work", calls::incrementAndGet)));

        WorkflowRun run = engine.trigger("once", Map.of(), 0);
        // a poller tick before the first dispatch ran hands the same run out again
        engine.resumeDueRuns();
        assertThat(queued).hasSize(2);

        queued.forEach(Runnable::run);

        assertThat(calls).hasValue(1);
        assertThat(engine.getRun(run.getId()).getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void rejectedDispatchIsLeftForThePoller() {
        AtomicInteger calls = new AtomicInteger();
        Workflow workflow = new ScriptedWorkflow("busy", ctx -> ctx.run("work", calls::incrementAndGet));
        WorkflowEngine rejecting = engine(task -> {
            throw new TaskRejectedException("queue full");
        }, workflow);

        WorkflowRun run = rejecting.trigger("busy", Map.of(), 0);
        assertThat(rejecting.getRun(run.getId()).getStatus()).isEqualTo(RunStatus.PENDING);

        syncEngine(workflow).resumeDueRuns();

        assertThat(calls).hasValue(1);
        assertThat(store.findRun(run.getId()).orElseThrow().getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void recoverStuckRuns_requeuesRunsOrphanedWhileRunning() {
        AtomicInteger calls = new AtomicInteger();
        WorkflowEngine engine = engine(queued::add, new ScriptedWorkflow("orphan",
                ctx -> ctx.run("work", calls::incrementAndGet)));
        WorkflowRun run = engine.trigger("orphan", Map.of(), 0);
        store.claim(run.getId(), clock.now());
        queued.clear();

        clock.advance(Duration.ofMinutes(10));
        assertThat(engine.recoverStuckRuns()).isZero();

        clock.advance(Duration.ofMinutes(6));
        assertThat(engine.recoverStuckRuns()).isEqualTo(1);
        assertThat(engine.getRun(run.getId()).getStatus()).isEqualTo(RunStatus.PENDING);

        engine.resumeDueRuns();
        queued.forEach(Runnable::run);
        assertThat(calls).hasValue(1);
        assertThat(engine.getRun(run.getId()).getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void purgeCompletedRuns_removesOnlyRunsPastRetention() {
        WorkflowEngine engine = syncEngine(new ScriptedWorkflow("short", ctx -> ctx.run("work", () -> { })));
        WorkflowRun old = engine.trigger("short", Map.of(), 0);
        clock.advance(Duration.ofDays(20));
        WorkflowRun recent = engine.trigger("short", Map.of(), 0);

        clock.advance(Duration.ofDays(11));
        assertThat(engine.purgeCompletedRuns()).isEqualTo(1);

        assertThat(store.findRun(old.getId())).isEmpty();
        assertThat(store.findSteps(old.getId())).isEmpty();
        assertThat(store.findRun(recent.getId())).isPresent();
    }

    @Test
    void getRun_unknownIdThrowsNotFound() {
        WorkflowEngine engine = syncEngine(new ScriptedWorkflow("simple", ctx -> { }));

        assertThatThrownBy(() -> engine.getRun(999L)).isInstanceOf(ResourceNotFoundException.class);
    }

    static class ScriptedWorkflow implements Workflow {

        private final String name;
        private final Consumer<WorkflowContext> script;

        ScriptedWorkflow(String name, Consumer<WorkflowContext> script) {
            this.name = name;
            this.script = script;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public void execute(WorkflowContext context) {
            script.accept(context);
        }
    }
}
