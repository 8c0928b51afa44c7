package com.subtrack.backend.repositories.workflow;

import com.subtrack.backend.models.workflow.WorkflowStep;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface WorkflowStepRepository extends JpaRepository<WorkflowStep, Long> {

    List<WorkflowStep> findByRunIdOrderByStepIndexAsc(Long runId);

    @Modifying
    @Query("DELETE FROM WorkflowStep s WHERE s.runId IN :runIds")
    int deleteByRunIdIn(@Param("runIds") Collection<Long> runIds);
}
