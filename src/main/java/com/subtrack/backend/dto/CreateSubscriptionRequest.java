package com.subtrack.backend.dto;

import com.subtrack.backend.models.Subscription;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Request DTO for creating a subscription.
 * renewalDate is optional and derived from startDate and frequency when absent.
 */
@Data
public class CreateSubscriptionRequest {
    @NotBlank(message = "Subscription name is required")
    @Size(min = 2, max = 100, message = "Subscription name must be between 2 and 100 characters")
    private String name;

    @NotNull(message = "Subscription price is required")
    @DecimalMin(value = "0.0", message = "Price must be greater than or equal to 0")
    private BigDecimal price;

    private Subscription.Currency currency;

    @NotNull(message = "Frequency is required")
    private Subscription.Frequency frequency;

    @NotNull(message = "Category is required")
    private Subscription.Category category;

    @NotBlank(message = "Payment method is required")
    private String paymentMethod;

    @NotNull(message = "Start date is required")
    private OffsetDateTime startDate;

    private OffsetDateTime renewalDate;
}
