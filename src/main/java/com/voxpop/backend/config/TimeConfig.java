package com.voxpop.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single source of truth for time. Age filters, opt-in stamps and import job timestamps all read
 * this clock instead of calling now() directly.
 */
@Configuration
public class TimeConfig {
    @Bean
    public Clock appClock() {
        return Clock.systemUTC();
    }
}
