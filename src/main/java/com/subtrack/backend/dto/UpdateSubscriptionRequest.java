package com.subtrack.backend.dto;

import com.subtrack.backend.models.Subscription;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
public class UpdateSubscriptionRequest {
    @Size(min = 2, max = 100, message = "Subscription name must be between 2 and 100 characters")
    private String name;

    @DecimalMin(value = "0.0", message = "Price must be greater than or equal to 0")
    private BigDecimal price;

    private Subscription.Currency currency;
    private Subscription.Frequency frequency;
    private Subscription.Category category;
    private String paymentMethod;
    private Subscription.SubscriptionStatus status;
    private OffsetDateTime renewalDate;
}
