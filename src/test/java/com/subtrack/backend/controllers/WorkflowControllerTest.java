package com.subtrack.backend.controllers;

import com.subtrack.backend.dto.SendRemindersRequest;
import com.subtrack.backend.dto.WorkflowRunDto;
import com.subtrack.backend.enums.RunStatus;
import com.subtrack.backend.enums.StepStatus;
import com.subtrack.backend.enums.StepType;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.models.workflow.WorkflowStep;
import com.subtrack.backend.services.reminder.ReminderWorkflow;
import com.subtrack.backend.workflow.WorkflowEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowControllerTest {

    @Mock
    private WorkflowEngine workflowEngine;

    @InjectMocks
    private WorkflowController workflowController;

    @Test
    void sendReminders_acceptsAndReturnsRunId() {
        when(workflowEngine.trigger(eq(ReminderWorkflow.NAME), any(SendRemindersRequest.class), eq(0)))
                .thenReturn(WorkflowRun.builder().id(5L).workflowName(ReminderWorkflow.NAME).build());

        ResponseEntity<Map<String, Object>> response =
                workflowController.sendReminders(new SendRemindersRequest(10L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody()).containsEntry("workflowRunId", 5L);
    }

    @Test
    void getRun_includesStepLog() {
        OffsetDateTime wakeAt = OffsetDateTime.parse("2024-02-08T00:00:00Z");
        when(workflowEngine.getRun(5L)).thenReturn(WorkflowRun.builder()
                .id(5L)
                .workflowName(ReminderWorkflow.NAME)
                .status(RunStatus.SLEEPING)
                .wakeAt(wakeAt)
                .completedStepCount(1)
                .build());
        when(workflowEngine.getSteps(5L)).thenReturn(List.of(
                WorkflowStep.builder().runId(5L).stepName("get subscription").stepIndex(0)
                        .stepType(StepType.RUN).status(StepStatus.COMPLETED).build(),
                WorkflowStep.builder().runId(5L).stepName("Reminder 7 days before").stepIndex(1)
                        .stepType(StepType.SLEEP).status(StepStatus.WAITING).wakeAt(wakeAt).build()));

        WorkflowRunDto dto = workflowController.getRun(5L).getBody();

        assertThat(dto).isNotNull();
        assertThat(dto.getStatus()).isEqualTo(RunStatus.SLEEPING);
        assertThat(dto.isFinished()).isFalse();
        assertThat(dto.getWakeAt()).isEqualTo(wakeAt);
        assertThat(dto.getSteps())
                .extracting(WorkflowRunDto.StepDto::getName)
                .containsExactly("get subscription", "Reminder 7 days before");
    }
}
