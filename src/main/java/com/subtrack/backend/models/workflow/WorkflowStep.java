package com.subtrack.backend.models.workflow;

import com.subtrack.backend.enums.StepStatus;
import com.subtrack.backend.enums.StepType;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * One entry of a run's step log. Step names are unique within a run; a COMPLETED entry is
 * what makes re-execution of the same name a no-op.
 */
@Entity
@Table(name = "workflow_steps", uniqueConstraints = {
        @UniqueConstraint(name = "uk_workflow_steps_run_name", columnNames = {"run_id", "step_name"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "step_name", nullable = false, length = 200)
    private String stepName;

    @Column(name = "step_index", nullable = false)
    private Integer stepIndex;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_type", nullable = false, length = 10)
    private StepType stepType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private StepStatus status;

    @Column(name = "output", columnDefinition = "TEXT")
    private String output;

    @Column(name = "wake_at")
    private OffsetDateTime wakeAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public boolean isCompleted() {
        return status != null && status.isCompleted();
    }
}
