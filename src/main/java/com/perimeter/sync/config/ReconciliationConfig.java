package com.perimeter.sync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ReconciliationConfig {

    /**
     * Wall clock for the initial lookback checkpoint. Production change
     * times are local timestamps, so this uses the system zone.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
