package com.fulqrom.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * One UTC clock for grant timestamps, deactivation times, token checks and entity auditing.
 */
@Configuration
public class TimeConfig {

    public static final String AUDITING_DATE_TIME_PROVIDER = "auditingDateTimeProvider";

    @Bean
    public Clock clock() {
        return Clock.system(ZoneOffset.UTC);
    }

    /**
     * Audit timestamps at TIMESTAMPTZ precision, so a reloaded entity reads back what was written.
     */
    @Bean(AUDITING_DATE_TIME_PROVIDER)
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(now(clock));
    }

    public static OffsetDateTime now(Clock clock) {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}
