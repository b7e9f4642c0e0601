package com.servicehealth.analytics;

import com.servicehealth.analytics.config.AnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * HealthAnalytics - Statistical analytics for service health samples
 *
 * Advisory engine layered on top of the health-check pipeline.
 * Every operation is fail-open: analytics problems never break health checks.
 *
 * Features:
 * - Rolling per-service baselines (mean / sample standard deviation)
 * - Z-score anomaly detection on availability and performance
 * - Status flapping detection
 * - Linear trend forecasts with volatility-based confidence
 * - Trailing 24h summary and retention cleanup
 */
@SpringBootApplication
@EnableConfigurationProperties(AnalyticsProperties.class)
public class HealthAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthAnalyticsApplication.class, args);
    }
}
