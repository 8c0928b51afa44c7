package com.subtrack.backend.services.reminder;

import com.subtrack.backend.config.ReminderProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;

/**
 * Reminder thresholds and the naming of the steps that serve them.
 * Thresholds are always walked from the furthest to the nearest.
 */
@Component
public class ReminderPolicy {

    private final List<Integer> thresholds;
    private final boolean recheckStatusOnResume;
    private final ZoneId zone;

    public ReminderPolicy(ReminderProperties properties, Clock clock) {
        List<Integer> configured = properties.daysBefore();
        if (configured == null || configured.isEmpty()) {
            throw new IllegalStateException("reminders.days-before must name at least one threshold");
        }
        for (Integer days : configured) {
            if (days == null || days <= 0) {
                throw new IllegalStateException("Reminder thresholds must be positive, got " + configured);
            }
        }
        this.thresholds = configured.stream()
                .distinct()
                .sorted(Comparator.reverseOrder())
                .toList();
        this.recheckStatusOnResume = properties.recheckStatusOnResume();
        this.zone = clock.getZone();
    }

    public List<Integer> thresholds() {
        return thresholds;
    }

    public boolean isRecheckStatusOnResume() {
        return recheckStatusOnResume;
    }

    /**
     * Name of the send step, also the email template label: "7 days before reminder"
     */
    public static String reminderLabel(int daysBefore) {
        return daysBefore + " days before reminder";
    }

    /**
     * Name of the sleep step: "Reminder 7 days before"
     */
    public static String sleepLabel(int daysBefore) {
        return "Reminder " + daysBefore + " days before";
    }

    public static String recheckLabel(int daysBefore) {
        return "check subscription " + daysBefore + " days before";
    }

    /**
     * The moment {@code daysBefore} calendar days ahead of renewal, counted in the application
     * time zone so a DST change in between keeps the local time of day.
     */
    public OffsetDateTime reminderDate(OffsetDateTime renewalDate, int daysBefore) {
        return renewalDate.atZoneSameInstant(zone)
                .minusDays(daysBefore)
                .toOffsetDateTime();
    }

    /**
     * Same calendar day in the application time zone
     */
    public boolean isSameDay(OffsetDateTime a, OffsetDateTime b) {
        return a.atZoneSameInstant(zone).toLocalDate()
                .equals(b.atZoneSameInstant(zone).toLocalDate());
    }
}
