package com.subtrack.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * A recurring subscription tracked for one user. The renewal date anchors every reminder.
 */
@Entity
@Table(name = "subscriptions", indexes = @Index(name = "idx_subscriptions_user", columnList = "user_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"user"})
@EqualsAndHashCode(exclude = {"user"})
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private Currency currency = Currency.USD;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Frequency frequency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Category category;

    @Column(name = "payment_method", nullable = false)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.ACTIVE;

    @Column(name = "start_date", nullable = false)
    private OffsetDateTime startDate;

    @Column(name = "renewal_date", nullable = false)
    private OffsetDateTime renewalDate;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isActive() {
        return status == SubscriptionStatus.ACTIVE;
    }

    public enum SubscriptionStatus {
        ACTIVE("active"),
        CANCELLED("cancelled"),
        EXPIRED("expired");

        private final String value;

        SubscriptionStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static SubscriptionStatus fromValue(String value) {
            for (SubscriptionStatus status : values()) {
                if (status.value.equalsIgnoreCase(value)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown subscription status: " + value);
        }
    }

    public enum Frequency {
        DAILY("daily", 1),
        WEEKLY("weekly", 7),
        MONTHLY("monthly", 30),
        YEARLY("yearly", 365);

        private final String value;
        private final int renewalPeriodDays;

        Frequency(String value, int renewalPeriodDays) {
            this.value = value;
            this.renewalPeriodDays = renewalPeriodDays;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        public int getRenewalPeriodDays() {
            return renewalPeriodDays;
        }

        @JsonCreator
        public static Frequency fromValue(String value) {
            for (Frequency frequency : values()) {
                if (frequency.value.equalsIgnoreCase(value)) {
                    return frequency;
                }
            }
            throw new IllegalArgumentException("Unknown subscription frequency: " + value);
        }
    }

    public enum Currency {
        USD,
        INR
    }

    public enum Category {
        STREAMING("Streaming"),
        MUSIC("Music"),
        VIDEO("Video"),
        GAMING("Gaming"),
        OTHER("Other");

        private final String displayName;

        Category(String displayName) {
            this.displayName = displayName;
        }

        @JsonValue
        public String getDisplayName() {
            return displayName;
        }

        @JsonCreator
        public static Category fromValue(String value) {
            for (Category category : values()) {
                if (category.displayName.equalsIgnoreCase(value)) {
                    return category;
                }
            }
            throw new IllegalArgumentException("Unknown subscription category: " + value);
        }
    }
}
