package com.subtrack.backend.controllers;

import com.subtrack.backend.dto.SendRemindersRequest;
import com.subtrack.backend.dto.WorkflowRunDto;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.services.reminder.ReminderWorkflow;
import com.subtrack.backend.util.SubscriptionMapper;
import com.subtrack.backend.workflow.WorkflowEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowEngine workflowEngine;

    /**
     * Start a reminder run for a subscription. The run proceeds in the background.
     */
    @PostMapping("/send-reminders")
    public ResponseEntity<Map<String, Object>> sendReminders(@Valid @RequestBody SendRemindersRequest request) {
        WorkflowRun run = workflowEngine.trigger(ReminderWorkflow.NAME, request, 0);
        log.info("Reminder run {} accepted for subscription {}", run.getId(), request.getSubscriptionId());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("success", true, "workflowRunId", run.getId()));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<WorkflowRunDto> getRun(@PathVariable Long id) {
        WorkflowRun run = workflowEngine.getRun(id);
        return ResponseEntity.ok(SubscriptionMapper.toDto(run, workflowEngine.getSteps(id)));
    }
}
