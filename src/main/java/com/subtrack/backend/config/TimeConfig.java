package com.subtrack.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Provides a single source of truth for time across the app.
 * Always use Clock injection instead of OffsetDateTime.now(). The clock's zone decides which
 * calendar day a reminder falls on.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock appClock(@Value("${app.time-zone:UTC}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
