package com.subtrack.backend.services.reminder;

import com.subtrack.backend.dto.SendRemindersRequest;
import com.subtrack.backend.repositories.SubscriptionRepository;
import com.subtrack.backend.workflow.Workflow;
import com.subtrack.backend.workflow.WorkflowContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Sends renewal reminders for one subscription, one per threshold.
 * <p>
 * The subscription is read once, in the "get subscription" step, and that snapshot drives
 * the whole run. Between thresholds the run sleeps until the reminder date. A reminder is
 * sent only on the calendar day of its reminder date; thresholds whose day has already
 * gone by are skipped. A sleep resumed within the host's wake tolerance is judged by its due
 * time rather than by the moment the poller got to it. Every send is its own step, so a replay never sends it twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReminderWorkflow implements Workflow {

    public static final String NAME = "send-reminders";
    public static final String FETCH_STEP = "get subscription";

    private final SubscriptionRepository subscriptionRepository;
    private final ReminderEmailService reminderEmailService;
    private final ReminderPolicy reminderPolicy;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void execute(WorkflowContext context) {
        SendRemindersRequest request = context.requestPayload(SendRemindersRequest.class);
        Long subscriptionId = request != null ? request.getSubscriptionId() : null;

        SubscriptionSnapshot subscription = context.run(FETCH_STEP, SubscriptionSnapshot.class,
                () -> fetchSubscription(subscriptionId));

        if (subscription == null || !subscription.isActive()) {
            log.info("Run {}: subscription {} is missing or not active. Stopping workflow.", context.getRunId(), subscriptionId);
            return;
        }

        OffsetDateTime renewalDate = subscription.getRenewalDate();
        if (renewalDate.isBefore(context.now())) {
            log.info("Run {}: renewal date has passed for subscription {}. Stopping workflow.", context.getRunId(), subscriptionId);
            return;
        }

        for (int daysBefore : reminderPolicy.thresholds()) {
            OffsetDateTime reminderDate = reminderPolicy.reminderDate(renewalDate, daysBefore);
            String sleepLabel = ReminderPolicy.sleepLabel(daysBefore);

            if (reminderDate.isAfter(context.now())) {
                log.info("Sleeping until {} reminder at {}", sleepLabel, reminderDate);
                context.sleepUntil(sleepLabel, reminderDate);
            }

            // a sleep resumed on time counts as its due time, even when the poller picked it up after midnight
            if (reminderPolicy.isSameDay(context.wokenAt(sleepLabel), reminderDate)) {
                if (reminderPolicy.isRecheckStatusOnResume() && !isStillActive(context, subscriptionId, daysBefore)) {
                    log.info("Subscription {} is no longer active. Stopping workflow.", subscriptionId);
                    return;
                }
                triggerReminder(context, ReminderPolicy.reminderLabel(daysBefore), subscription);
            }
        }
    }

    private SubscriptionSnapshot fetchSubscription(Long subscriptionId) {
        if (subscriptionId == null) {
            return null;
        }
        return subscriptionRepository.findWithUserById(subscriptionId)
                .map(SubscriptionSnapshot::from)
                .orElse(null);
    }

    private boolean isStillActive(WorkflowContext context, Long subscriptionId, int daysBefore) {
        Boolean active = context.run(ReminderPolicy.recheckLabel(daysBefore), Boolean.class, () -> {
            SubscriptionSnapshot current = fetchSubscription(subscriptionId);
            return current != null && current.isActive();
        });
        return Boolean.TRUE.equals(active);
    }

    private void triggerReminder(WorkflowContext context, String label, SubscriptionSnapshot subscription) {
        log.info("Triggering {} reminder", label);
        context.run(label, String.class,
                () -> reminderEmailService.sendReminderEmail(subscription.getUserEmail(), label, subscription));
    }
}
