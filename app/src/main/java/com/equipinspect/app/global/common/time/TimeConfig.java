package com.equipinspect.app.global.common.time;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the single clock every module reads "today" and audit timestamps from.
 * Uses the machine's zone since inspection dates are local calendar dates.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
