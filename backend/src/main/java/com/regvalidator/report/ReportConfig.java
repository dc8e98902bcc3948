package com.regvalidator.report;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock used for report generation timestamps; tests replace it with a fixed clock.
 */
@Configuration
public class ReportConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
