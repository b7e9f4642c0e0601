package com.servicehealth.analytics.service;

import com.servicehealth.analytics.dto.AnomalyKind;
import com.servicehealth.analytics.dto.AnomalyRecord;
import com.servicehealth.analytics.dto.AnomalySeverity;
import com.servicehealth.analytics.dto.Baseline;
import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.StatusPoint;
import com.servicehealth.analytics.exception.MetricsStoreException;
import com.servicehealth.analytics.store.MetricsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Compares a sample against its service baseline.
 *
 * Availability and performance are checked with a z-score against the baseline;
 * flapping is checked on the recent status history and does not use the baseline.
 * The checks are independent, so one sample can yield several anomalies.
 */
@Slf4j
@Component
public class AnomalyDetector {

    static final double CRITICAL_Z_SCORE = 3.0;
    static final Duration FLAPPING_WINDOW = Duration.ofHours(1);
    static final int FLAPPING_SAMPLE_LIMIT = 10;
    static final int MAX_STABLE_STATUSES = 2;
    static final double FLAPPING_CONFIDENCE = 75.0;

    private final MetricsStore metricsStore;

    public AnomalyDetector(MetricsStore metricsStore) {
        this.metricsStore = metricsStore;
    }

    /**
     * Runs every check for {@code sample}. Anomaly timestamps are taken from the
     * sample, so identical input produces identical records.
     *
     * @param threshold z-score a deviation must strictly exceed to be reported
     */
    public List<AnomalyRecord> detect(MetricSample sample, Baseline baseline, double threshold) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        detectAvailabilityAnomaly(sample, baseline, threshold).ifPresent(anomalies::add);
        detectPerformanceAnomaly(sample, baseline, threshold).ifPresent(anomalies::add);
        detectFlapping(sample).ifPresent(anomalies::add);
        return anomalies;
    }

    public Optional<AnomalyRecord> detectAvailabilityAnomaly(MetricSample sample, Baseline baseline, double threshold) {
        Double current = sample.getAvailabilityScore();
        if (current == null) {
            return Optional.empty();
        }
        double mean = baseline.getAvailabilityMean();
        return zScore(current, mean, baseline.getAvailabilityStd(), threshold)
            .map(z -> deviation(sample, z,
                current < mean ? AnomalyKind.AVAILABILITY_DROP : AnomalyKind.UNUSUAL_BEHAVIOR,
                String.format(Locale.ROOT,
                    "Availability anomaly detected: %.1f%% (baseline: %.1f%%, z-score: %.2f)", current, mean, z),
                "availability_score", current));
    }

    public Optional<AnomalyRecord> detectPerformanceAnomaly(MetricSample sample, Baseline baseline, double threshold) {
        Double current = sample.getPerformanceScore();
        if (current == null) {
            return Optional.empty();
        }
        double mean = baseline.getPerformanceMean();
        return zScore(current, mean, baseline.getPerformanceStd(), threshold)
            .map(z -> deviation(sample, z,
                current < mean ? AnomalyKind.PERFORMANCE_DEGRADATION : AnomalyKind.UNUSUAL_BEHAVIOR,
                String.format(Locale.ROOT,
                    "Performance anomaly detected: %.1f (baseline: %.1f, z-score: %.2f)", current, mean, z),
                "performance_score", current));
    }

    /**
     * Looks at the last {@value #FLAPPING_SAMPLE_LIMIT} statuses recorded in the hour
     * up to and including the sample timestamp. Rows stored later are ignored.
     * A store failure skips the check.
     */
    public Optional<AnomalyRecord> detectFlapping(MetricSample sample) {
        Instant until = sample.getTimestamp();
        Instant since = until.minus(FLAPPING_WINDOW);
        List<StatusPoint> recent;
        try {
            recent = metricsStore.queryRecentStatuses(sample.getServiceName(), since, until, FLAPPING_SAMPLE_LIMIT);
        } catch (MetricsStoreException e) {
            log.error("Status anomaly detection failed for {}: {}", sample.getServiceName(), e.getMessage(), e);
            return Optional.empty();
        }
        return evaluateFlapping(sample, recent);
    }

    Optional<AnomalyRecord> evaluateFlapping(MetricSample sample, List<StatusPoint> recentStatuses) {
        if (recentStatuses.size() < 2) {
            return Optional.empty();
        }

        Set<String> distinct = new LinkedHashSet<>();
        for (StatusPoint point : recentStatuses) {
            distinct.add(point.status());
        }
        if (distinct.size() <= MAX_STABLE_STATUSES) {
            return Optional.empty();
        }

        log.debug("Flapping detected for {}: statuses={}", sample.getServiceName(), distinct);
        return Optional.of(AnomalyRecord.builder()
            .timestamp(sample.getTimestamp())
            .serviceName(sample.getServiceName())
            .kind(AnomalyKind.SERVICE_FLAPPING)
            .severity(AnomalySeverity.WARNING)
            .description(String.format(Locale.ROOT,
                "Service status flapping detected: %d different statuses in the last hour", distinct.size()))
            .confidence(FLAPPING_CONFIDENCE)
            .affectedMetric("status_changes", distinct.size())
            .affectedMetric("current_status", sample.getStatus())
            .build());
    }

    /**
     * Absolute z-score if it strictly exceeds the threshold. A zero standard
     * deviation leaves the z-score undefined and nothing is reported.
     */
    static Optional<Double> zScore(double value, double mean, double std, double threshold) {
        if (std == 0.0) {
            return Optional.empty();
        }
        double z = Math.abs(value - mean) / std;
        return z > threshold ? Optional.of(z) : Optional.empty();
    }

    private static AnomalyRecord deviation(MetricSample sample, double z, AnomalyKind kind,
                                           String description, String metricName, double value) {
        return AnomalyRecord.builder()
            .timestamp(sample.getTimestamp())
            .serviceName(sample.getServiceName())
            .kind(kind)
            .severity(z > CRITICAL_Z_SCORE ? AnomalySeverity.CRITICAL : AnomalySeverity.WARNING)
            .description(description)
            .confidence(Math.min(z / CRITICAL_Z_SCORE * 100, 100))
            .affectedMetric(metricName, value)
            .affectedMetric("z_score", z)
            .build();
    }
}
