package com.subtrack.backend.dto;

import com.subtrack.backend.models.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionDto {
    private Long id;
    private String name;
    private BigDecimal price;
    private Subscription.Currency currency;
    private Subscription.Frequency frequency;
    private Subscription.Category category;
    private String paymentMethod;
    private Subscription.SubscriptionStatus status;
    private OffsetDateTime startDate;
    private OffsetDateTime renewalDate;
    private Long userId;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
