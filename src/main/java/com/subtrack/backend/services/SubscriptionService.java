package com.subtrack.backend.services;

import com.subtrack.backend.dto.CreateSubscriptionRequest;
import com.subtrack.backend.dto.SendRemindersRequest;
import com.subtrack.backend.dto.UpdateSubscriptionRequest;
import com.subtrack.backend.exceptions.ResourceNotFoundException;
import com.subtrack.backend.exceptions.UnauthorizedException;
import com.subtrack.backend.models.Subscription;
import com.subtrack.backend.models.User;
import com.subtrack.backend.models.workflow.WorkflowRun;
import com.subtrack.backend.repositories.SubscriptionRepository;
import com.subtrack.backend.services.reminder.ReminderWorkflow;
import com.subtrack.backend.workflow.WorkflowEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Subscription CRUD for the signed-in user. Creating a subscription starts its reminder run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    /**
     * Reminder runs are not retried; a failed send leaves the run FAILED
     */
    static final int REMINDER_RETRIES = 0;

    private final SubscriptionRepository subscriptionRepository;
    private final WorkflowEngine workflowEngine;
    private final Clock clock;

    public record CreatedSubscription(Subscription subscription, Long workflowRunId) {
    }

    @Transactional
    public CreatedSubscription createSubscription(CreateSubscriptionRequest request, User user) {
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (request.getStartDate().isAfter(now)) {
            throw new IllegalArgumentException("Start date must be in the past");
        }

        Subscription subscription = Subscription.builder()
                .name(request.getName().trim())
                .price(request.getPrice())
                .currency(request.getCurrency() != null ? request.getCurrency() : Subscription.Currency.USD)
                .frequency(request.getFrequency())
                .category(request.getCategory())
                .paymentMethod(request.getPaymentMethod().trim())
                .startDate(request.getStartDate())
                .renewalDate(request.getRenewalDate())
                .user(user)
                .build();

        applyRenewalRules(subscription, now);

        Subscription saved = subscriptionRepository.save(subscription);
        log.info("Created subscription {} for user {} renewing at {}", saved.getId(), user.getId(), saved.getRenewalDate());

        // Dispatched after commit, so the run finds the row
        WorkflowRun run = workflowEngine.trigger(
                ReminderWorkflow.NAME, new SendRemindersRequest(saved.getId()), REMINDER_RETRIES);

        return new CreatedSubscription(saved, run.getId());
    }

    @Transactional(readOnly = true)
    public List<Subscription> getUserSubscriptions(Long userId, User caller) {
        if (!caller.getId().equals(userId)) {
            throw new UnauthorizedException("Unauthorized");
        }
        return subscriptionRepository.findByUserIdOrderByRenewalDateAsc(userId);
    }

    @Transactional(readOnly = true)
    public Subscription getSubscription(Long id, User caller) {
        return findOwned(id, caller);
    }

    @Transactional
    public Subscription updateSubscription(Long id, UpdateSubscriptionRequest request, User caller) {
        Subscription subscription = findOwned(id, caller);

        if (request.getName() != null) {
            subscription.setName(request.getName().trim());
        }
        if (request.getPrice() != null) {
            subscription.setPrice(request.getPrice());
        }
        if (request.getCurrency() != null) {
            subscription.setCurrency(request.getCurrency());
        }
        if (request.getFrequency() != null) {
            subscription.setFrequency(request.getFrequency());
        }
        if (request.getCategory() != null) {
            subscription.setCategory(request.getCategory());
        }
        if (request.getPaymentMethod() != null) {
            subscription.setPaymentMethod(request.getPaymentMethod().trim());
        }
        if (request.getStatus() != null) {
            subscription.setStatus(request.getStatus());
        }
        if (request.getRenewalDate() != null) {
            subscription.setRenewalDate(request.getRenewalDate());
        }

        applyRenewalRules(subscription, OffsetDateTime.now(clock));
        return subscriptionRepository.save(subscription);
    }

    @Transactional
    public Subscription deleteSubscription(Long id, User caller) {
        Subscription subscription = findOwned(id, caller);
        subscriptionRepository.delete(subscription);
        log.info("Deleted subscription {} of user {}", id, caller.getId());
        return subscription;
    }

    /**
     * Derive a missing renewal date from the start date and frequency, reject a renewal date
     * that is not after the start date, and expire a subscription whose renewal date has passed.
     */
    void applyRenewalRules(Subscription subscription, OffsetDateTime now) {
        if (subscription.getRenewalDate() == null) {
            subscription.setRenewalDate(subscription.getStartDate()
                    .plusDays(subscription.getFrequency().getRenewalPeriodDays()));
        } else if (!subscription.getRenewalDate().isAfter(subscription.getStartDate())) {
            throw new IllegalArgumentException("Renewal date must be after the start date");
        }

        if (subscription.getRenewalDate().isBefore(now)) {
            subscription.setStatus(Subscription.SubscriptionStatus.EXPIRED);
        }
    }

    private Subscription findOwned(Long id, User caller) {
        Subscription subscription = subscriptionRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Subscription not found"));
        if (!subscription.getUser().getId().equals(caller.getId())) {
            throw new AccessDeniedException("Subscription belongs to another user");
        }
        return subscription;
    }
}
