package com.subtrack.backend.util;

import com.subtrack.backend.dto.SubscriptionDto;
import com.subtrack.backend.dto.UserDto;
import com.subtrack.backend.dto.WorkflowRunDto;
import com.subtrack.backend.models.Subscription;
import com.subtrack.backend.models.User;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.models.workflow.WorkflowStep;

import java.util.List;

public class SubscriptionMapper {

    private SubscriptionMapper() {
    }

    public static SubscriptionDto toDto(Subscription subscription) {
        if (subscription == null) {
            return null;
        }

        return SubscriptionDto.builder()
                .id(subscription.getId())
                .name(subscription.getName())
                .price(subscription.getPrice())
                .currency(subscription.getCurrency())
                .frequency(subscription.getFrequency())
                .category(subscription.getCategory())
                .paymentMethod(subscription.getPaymentMethod())
                .status(subscription.getStatus())
                .startDate(subscription.getStartDate())
                .renewalDate(subscription.getRenewalDate())
                .userId(subscription.getUser() != null ? subscription.getUser().getId() : null)
                .createdAt(subscription.getCreatedAt())
                .updatedAt(subscription.getUpdatedAt())
                .build();
    }

    public static UserDto toDto(User user) {
        if (user == null) {
            return null;
        }

        return UserDto.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .createdAt(user.getCreatedAt())
                .build();
    }

    public static WorkflowRunDto toDto(WorkflowRun run, List<WorkflowStep> steps) {
        return WorkflowRunDto.builder()
                .id(run.getId())
                .workflowName(run.getWorkflowName())
                .status(run.getStatus())
                .finished(run.isFinished())
                .wakeAt(run.getWakeAt())
                .completedStepCount(run.getCompletedStepCount())
                .attempt(run.getAttempt())
                .failureReason(run.getFailureReason())
                .createdAt(run.getCreatedAt())
                .completedAt(run.getCompletedAt())
                .steps(steps.stream()
                        .map(step -> WorkflowRunDto.StepDto.builder()
                                .name(step.getStepName())
                                .type(step.getStepType())
                                .status(step.getStatus())
                                .wakeAt(step.getWakeAt())
                                .completedAt(step.getCompletedAt())
                                .errorMessage(step.getErrorMessage())
                                .build())
                        .toList())
                .build();
    }
}
