package com.subtrack.backend.workflow;

import com.subtrack.backend.enums.RunStatus;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.models.workflow.WorkflowStep;
import com.subtrack.backend.repositories.workflow.WorkflowRunRepository;
import com.subtrack.backend.repositories.workflow.WorkflowStepRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class JpaWorkflowStore implements WorkflowStore {

    private static final Set<RunStatus> RESUMABLE = EnumSet.of(RunStatus.PENDING, RunStatus.SLEEPING);

    private final WorkflowRunRepository runRepository;
    private final WorkflowStepRepository stepRepository;

    @Override
    public WorkflowRun saveRun(WorkflowRun run) {
        return runRepository.save(run);
    }

    @Override
    public Optional<WorkflowRun> findRun(Long runId) {
        return runRepository.findById(runId);
    }

    @Override
    @Transactional
    public boolean claim(Long runId, OffsetDateTime now) {
        return runRepository.claim(runId, RESUMABLE, now) == 1;
    }

    @Override
    public List<WorkflowRun> findDueRuns(OffsetDateTime now) {
        return runRepository.findDueRuns(RESUMABLE, now);
    }

    @Override
    public List<WorkflowRun> findRunningNotUpdatedSince(OffsetDateTime cutoff) {
        return runRepository.findByStatusAndUpdatedAtBefore(RunStatus.RUNNING, cutoff);
    }

    @Override
    public List<WorkflowStep> findSteps(Long runId) {
        return stepRepository.findByRunIdOrderByStepIndexAsc(runId);
    }

    @Override
    public WorkflowStep saveStep(WorkflowStep step) {
        return stepRepository.save(step);
    }

    @Override
    @Transactional
    public int deleteCompletedBefore(OffsetDateTime cutoff) {
        List<WorkflowRun> finished = runRepository.findByStatusAndCompletedAtBefore(RunStatus.COMPLETED, cutoff);
        if (finished.isEmpty()) {
            return 0;
        }
        List<Long> runIds = finished.stream().map(WorkflowRun::getId).toList();
        stepRepository.deleteByRunIdIn(runIds);
        runRepository.deleteAll(finished);
        return finished.size();
    }
}
