package com.subtrack.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * @param daysBefore            reminder thresholds in days before renewal
 * @param recheckStatusOnResume re-read the live subscription before each reminder instead of
 *                              relying on the snapshot taken when the run started
 */
@ConfigurationProperties(prefix = "reminders")
public record ReminderProperties(
        @DefaultValue({"7", "5", "3", "1"}) List<Integer> daysBefore,
        @DefaultValue("false") boolean recheckStatusOnResume
) {
}
