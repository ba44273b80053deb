package com.shopadmin.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * The UTC clock is the only time source: override expiry, grant timestamps, audit entries and the
 * {@code created_at}/{@code updated_at} columns all read it, so a fixed clock in tests pins every one of them.
 */
@Configuration
public class TimeConfig {

    public static final String AUDITING_TIME_PROVIDER = "clockDateTimeProvider";

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean(AUDITING_TIME_PROVIDER)
    public DateTimeProvider clockDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
