package com.subtrack.backend.models.workflow;

import com.subtrack.backend.enums.RunStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Durable state of one workflow execution. The run row itself is the suspension point:
 * a SLEEPING run holds no thread, only a wake time the poller looks for.
 */
@Entity
@Table(name = "workflow_runs", indexes = {
        @Index(name = "idx_workflow_runs_status_wake", columnList = "status, wake_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_name", nullable = false, length = 100)
    private String workflowName;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "wake_at")
    private OffsetDateTime wakeAt;

    @Min(0)
    @Column(name = "completed_step_count", nullable = false)
    @Builder.Default
    private Integer completedStepCount = 0;

    @Min(0)
    @Column(name = "attempt", nullable = false)
    @Builder.Default
    private Integer attempt = 0;

    @Min(0) @Max(10)
    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private Integer maxRetries = 0;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public boolean isFinished() {
        return status != null && status.isFinished();
    }

    public boolean canRetry() {
        return attempt < maxRetries;
    }
}
