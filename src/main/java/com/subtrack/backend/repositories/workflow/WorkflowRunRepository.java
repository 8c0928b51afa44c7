package com.subtrack.backend.repositories.workflow;

import com.subtrack.backend.enums.RunStatus;
import com.subtrack.backend.models.workflow.WorkflowRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface WorkflowRunRepository extends JpaRepository<WorkflowRun, Long> {

    @Query("SELECT r FROM WorkflowRun r WHERE r.status IN :statuses AND r.wakeAt <= :now ORDER BY r.wakeAt ASC")
    List<WorkflowRun> findDueRuns(@Param("statuses") Collection<RunStatus> statuses, @Param("now") OffsetDateTime now);

    List<WorkflowRun> findByStatusAndUpdatedAtBefore(RunStatus status, OffsetDateTime updatedAt);

    List<WorkflowRun> findByStatusAndCompletedAtBefore(RunStatus status, OffsetDateTime completedAt);

    /**
     * Compare-and-set claim: only one caller can move a due run to RUNNING
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE WorkflowRun r SET r.status = com.subtrack.backend.enums.RunStatus.RUNNING, r.updatedAt = :now " +
            "WHERE r.id = :id AND r.status IN :statuses AND (r.wakeAt IS NULL OR r.wakeAt <= :now)")
    int claim(@Param("id") Long id, @Param("statuses") Collection<RunStatus> statuses, @Param("now") OffsetDateTime now);
}
