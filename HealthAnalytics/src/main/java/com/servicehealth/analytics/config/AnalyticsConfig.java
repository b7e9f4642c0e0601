package com.servicehealth.analytics.config;

import com.servicehealth.analytics.service.BaselineCache;
import com.servicehealth.analytics.service.InMemoryBaselineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring of the analytics engine collaborators that are not components themselves.
 */
@Configuration
public class AnalyticsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BaselineCache baselineCache(AnalyticsProperties properties, Clock clock) {
        return new InMemoryBaselineCache(
            properties.getBaselineTtl(),
            properties.getBaselineRefreshSamples(),
            clock);
    }
}
