package com.subtrack.backend.dto;

import com.subtrack.backend.enums.RunStatus;
import com.subtrack.backend.enums.StepStatus;
import com.subtrack.backend.enums.StepType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRunDto {
    private Long id;
    private String workflowName;
    private RunStatus status;
    private boolean finished;
    private OffsetDateTime wakeAt;
    private Integer completedStepCount;
    private Integer attempt;
    private String failureReason;
    private OffsetDateTime createdAt;
    private OffsetDateTime completedAt;
    private List<StepDto> steps;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StepDto {
        private String name;
        private StepType type;
        private StepStatus status;
        private OffsetDateTime wakeAt;
        private OffsetDateTime completedAt;
        private String errorMessage;
    }
}
