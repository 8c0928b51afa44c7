package com.subtrack.backend.services.reminder;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.subtrack.backend.models.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Subscription as read by the "get subscription" step, with the owner's name and email.
 * This is what the reminder run remembers; replays see this copy, not the live row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionSnapshot {
    private Long id;
    private String name;
    private BigDecimal price;
    private Subscription.Currency currency;
    private Subscription.Frequency frequency;
    private Subscription.Category category;
    private String paymentMethod;
    private Subscription.SubscriptionStatus status;
    private OffsetDateTime renewalDate;
    private String userName;
    private String userEmail;

    public static SubscriptionSnapshot from(Subscription subscription) {
        return SubscriptionSnapshot.builder()
                .id(subscription.getId())
                .name(subscription.getName())
                .price(subscription.getPrice())
                .currency(subscription.getCurrency())
                .frequency(subscription.getFrequency())
                .category(subscription.getCategory())
                .paymentMethod(subscription.getPaymentMethod())
                .status(subscription.getStatus())
                .renewalDate(subscription.getRenewalDate())
                .userName(subscription.getUser().getName())
                .userEmail(subscription.getUser().getEmail())
                .build();
    }

    @JsonIgnore
    public boolean isActive() {
        return status == Subscription.SubscriptionStatus.ACTIVE;
    }
}
