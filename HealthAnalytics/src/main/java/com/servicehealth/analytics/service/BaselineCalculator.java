package com.servicehealth.analytics.service;

import com.servicehealth.analytics.dto.Baseline;
import com.servicehealth.analytics.dto.MetricValues;
import com.servicehealth.analytics.exception.MetricsStoreException;
import com.servicehealth.analytics.store.MetricsStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Computes per-service baselines from the most recent samples in the learning window.
 */
@Slf4j
@Component
public class BaselineCalculator {

    static final int MAX_SAMPLES = 1000;

    private final MetricsStore metricsStore;
    private final Clock clock;

    public BaselineCalculator(MetricsStore metricsStore, Clock clock) {
        this.metricsStore = metricsStore;
        this.clock = clock;
    }

    /**
     * Reads up to {@value #MAX_SAMPLES} samples of {@code serviceName} from the last
     * {@code learningWindowDays} days and summarizes them.
     *
     * @return the baseline, INSUFFICIENT_DATA below {@code minSamples} rows, FAILED if the store is unavailable
     */
    public AnalysisResult<Baseline> compute(String serviceName, int learningWindowDays, int minSamples) {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(learningWindowDays));

        List<MetricValues> rows;
        try {
            rows = metricsStore.queryRecent(serviceName, since, MAX_SAMPLES);
        } catch (MetricsStoreException e) {
            log.error("Failed to calculate baseline for {}: {}", serviceName, e.getMessage(), e);
            return AnalysisResult.failed("store unavailable", e);
        }

        if (rows.size() < minSamples) {
            log.debug("Insufficient data for baseline: service={}, samples={}, required={}",
                serviceName, rows.size(), minSamples);
            return AnalysisResult.insufficientData(rows.size() + " of " + minSamples + " samples");
        }

        List<Double> availability = column(rows, MetricValues::availabilityScore);
        List<Double> performance = column(rows, MetricValues::performanceScore);
        List<Double> responseTimes = column(rows, MetricValues::responseTime);

        Baseline baseline = Baseline.builder()
            .serviceName(serviceName)
            .availabilityMean(Statistics.mean(availability))
            .availabilityStd(Statistics.standardDeviation(availability))
            .performanceMean(Statistics.mean(performance))
            .performanceStd(Statistics.standardDeviation(performance))
            .responseTimeMean(Statistics.mean(responseTimes))
            .responseTimeStd(Statistics.standardDeviation(responseTimes))
            .sampleCount(rows.size())
            .computedAt(now)
            .build();

        log.debug("Computed baseline for {}: samples={}, availability={} (std {}), performance={} (std {})",
            serviceName, rows.size(), baseline.getAvailabilityMean(), baseline.getAvailabilityStd(),
            baseline.getPerformanceMean(), baseline.getPerformanceStd());
        return AnalysisResult.ok(baseline);
    }

    private static List<Double> column(List<MetricValues> rows, Function<MetricValues, Double> extractor) {
        List<Double> values = new ArrayList<>(rows.size());
        for (MetricValues row : rows) {
            Double value = extractor.apply(row);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
