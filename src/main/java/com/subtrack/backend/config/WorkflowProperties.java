package com.subtrack.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tuning for the durable workflow host.
 *
 * @param retryDelay how long a failed run waits before its next attempt (only when the run allows retries)
 * @param stuckAfter a RUNNING run not updated for this long is assumed orphaned by a dead worker
 * @param retention  how long COMPLETED runs and their step logs are kept
 * @param wakeTolerance a sleep picked up no later than this after its due time counts as woken on time
 */
@ConfigurationProperties(prefix = "workflow")
public record WorkflowProperties(
        @DefaultValue("PT1M") Duration retryDelay,
        @DefaultValue("PT15M") Duration stuckAfter,
        @DefaultValue("P30D") Duration retention,
        @DefaultValue("PT5M") Duration wakeTolerance
) {
}
