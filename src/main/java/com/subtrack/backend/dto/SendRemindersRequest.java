package com.subtrack.backend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Start payload of a reminder run. Stored as the run's payload JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendRemindersRequest {
    @NotNull(message = "subscriptionId is required")
    private Long subscriptionId;
}
