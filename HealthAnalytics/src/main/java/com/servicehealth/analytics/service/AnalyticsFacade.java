package com.servicehealth.analytics.service;

import com.servicehealth.analytics.config.AnalyticsProperties;
import com.servicehealth.analytics.dto.AnomalyRecord;
import com.servicehealth.analytics.dto.Baseline;
import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.PredictionRecord;
import com.servicehealth.analytics.dto.SummaryReport;
import com.servicehealth.analytics.store.MetricsStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the analytics engine.
 *
 * Every public operation is fail-open: storage failures and missing history are
 * logged and reported to the caller as an empty result, never as an exception.
 * Writes to the store are serialized by a single lock.
 */
@Slf4j
@Service
public class AnalyticsFacade {

    static final Duration SUMMARY_WINDOW = Duration.ofHours(24);
    static final int MAX_HISTORY = 1000;

    private final MetricsStore metricsStore;
    private final BaselineCalculator baselineCalculator;
    private final BaselineCache baselineCache;
    private final AnomalyDetector anomalyDetector;
    private final TrendForecaster trendForecaster;
    private final AnalyticsProperties properties;
    private final Clock clock;

    private final ReentrantLock writeLock = new ReentrantLock();

    public AnalyticsFacade(MetricsStore metricsStore,
                           BaselineCalculator baselineCalculator,
                           BaselineCache baselineCache,
                           AnomalyDetector anomalyDetector,
                           TrendForecaster trendForecaster,
                           AnalyticsProperties properties,
                           Clock clock) {
        this.metricsStore = metricsStore;
        this.baselineCalculator = baselineCalculator;
        this.baselineCache = baselineCache;
        this.anomalyDetector = anomalyDetector;
        this.trendForecaster = trendForecaster;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Persists a health sample. A sample without timestamp is stamped with the current time.
     */
    public void recordSample(MetricSample sample) {
        if (!properties.isEnabled() || !isValid(sample)) {
            return;
        }
        MetricSample stamped = stamp(sample);
        try {
            withWriteLock(() -> metricsStore.insertSample(stamped));
            baselineCache.onSampleRecorded(stamped.getServiceName());
            log.debug("Recorded sample: service={}, status={}", stamped.getServiceName(), stamped.getStatus());
        } catch (Exception e) {
            log.error("Failed to record service metrics for {}: {}", stamped.getServiceName(), e.getMessage(), e);
        }
    }

    /**
     * Compares the sample with its service baseline and persists every anomaly found.
     *
     * @return the anomalies, empty when there is no baseline yet or analytics is unavailable
     */
    public List<AnomalyRecord> detectAnomalies(MetricSample sample) {
        if (!properties.isEnabled() || !properties.isAnomalyDetection() || !isValid(sample)) {
            return Collections.emptyList();
        }
        MetricSample stamped = stamp(sample);
        String serviceName = stamped.getServiceName();
        try {
            AnalysisResult<Baseline> baseline = resolveBaseline(serviceName);
            if (!baseline.isOk()) {
                log.debug("No baseline for anomaly detection: service={}, outcome={}, reason={}",
                    serviceName, baseline.getOutcome(), baseline.getReason());
                return Collections.emptyList();
            }

            List<AnomalyRecord> anomalies = anomalyDetector.detect(
                stamped, baseline.getValue(), properties.getAnomalyThreshold());
            for (AnomalyRecord anomaly : anomalies) {
                persist(() -> metricsStore.insertAnomaly(anomaly), "anomaly", serviceName);
            }
            if (!anomalies.isEmpty()) {
                log.info("Detected {} anomalies for {}", anomalies.size(), serviceName);
            }
            return anomalies;
        } catch (Exception e) {
            log.error("Anomaly detection failed for {}: {}", serviceName, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    /**
     * Fits a trend over the learning window history and persists the forecasts.
     *
     * @param horizonHours forecast horizon; non-positive values fall back to the configured default
     */
    public List<PredictionRecord> generatePredictions(String serviceName, int horizonHours) {
        if (!properties.isEnabled() || !properties.isPredictiveAnalysis() || StringUtils.isBlank(serviceName)) {
            return Collections.emptyList();
        }
        int horizon = horizonHours;
        if (horizon <= 0) {
            log.warn("Invalid prediction horizon {}h for {}, using default {}h",
                horizonHours, serviceName, properties.getPredictionHorizonHours());
            horizon = properties.getPredictionHorizonHours();
        }
        try {
            Instant since = clock.instant().minus(Duration.ofDays(properties.getLearningWindowDays()));
            List<MetricSample> history = metricsStore.queryHistory(serviceName, since, MAX_HISTORY);

            List<PredictionRecord> predictions = trendForecaster.predict(serviceName, history, horizon);
            for (PredictionRecord prediction : predictions) {
                persist(() -> metricsStore.insertPrediction(prediction), "prediction", serviceName);
            }
            log.debug("Generated {} predictions for {} ({} samples, {}h)",
                predictions.size(), serviceName, history.size(), horizon);
            return predictions;
        } catch (Exception e) {
            log.error("Prediction generation failed for {}: {}", serviceName, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    /**
     * Aggregates anomalies, predictions and service health over the trailing 24 hours.
     */
    public SummaryReport getSummary() {
        Instant now = clock.instant();
        if (!properties.isEnabled()) {
            return SummaryReport.empty(now);
        }
        try {
            return metricsStore.aggregateSummary(now.minus(SUMMARY_WINDOW), now);
        } catch (Exception e) {
            log.error("Failed to generate analytics summary: {}", e.getMessage(), e);
            return SummaryReport.empty(now);
        }
    }

    /**
     * Baseline currently used for {@code serviceName}, computed if not cached.
     */
    public Optional<Baseline> getBaseline(String serviceName) {
        if (!properties.isEnabled() || StringUtils.isBlank(serviceName)) {
            return Optional.empty();
        }
        try {
            return resolveBaseline(serviceName).toOptional();
        } catch (Exception e) {
            log.error("Failed to resolve baseline for {}: {}", serviceName, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Deletes samples, anomalies and predictions older than {@code daysToKeep} days.
     *
     * @return number of deleted samples, 0 on failure
     */
    public int cleanupOldData(int daysToKeep) {
        if (!properties.isEnabled()) {
            return 0;
        }
        if (daysToKeep <= 0) {
            log.warn("Invalid retention of {} days, using default {}",
                daysToKeep, properties.getRetention().getDaysToKeep());
            daysToKeep = properties.getRetention().getDaysToKeep();
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysToKeep));
        try {
            int[] deleted = new int[1];
            withWriteLock(() -> deleted[0] = metricsStore.deleteOlderThan(cutoff));
            baselineCache.invalidateAll();
            log.info("Cleaned up {} old analytics records (older than {})", deleted[0], cutoff);
            return deleted[0];
        } catch (Exception e) {
            log.error("Failed to cleanup analytics data: {}", e.getMessage(), e);
            return 0;
        }
    }

    AnalysisResult<Baseline> resolveBaseline(String serviceName) {
        return baselineCache.getOrCompute(serviceName, () -> baselineCalculator.compute(
            serviceName, properties.getLearningWindowDays(), properties.getMinSamples()));
    }

    private void persist(Runnable write, String what, String serviceName) {
        try {
            withWriteLock(write);
        } catch (Exception e) {
            log.error("Failed to record {} for {}: {}", what, serviceName, e.getMessage(), e);
        }
    }

    private void withWriteLock(Runnable write) {
        writeLock.lock();
        try {
            write.run();
        } finally {
            writeLock.unlock();
        }
    }

    private MetricSample stamp(MetricSample sample) {
        return sample.getTimestamp() != null ? sample : sample.toBuilder().timestamp(clock.instant()).build();
    }

    private static boolean isValid(MetricSample sample) {
        if (sample == null || StringUtils.isBlank(sample.getServiceName())) {
            log.warn("Ignoring sample without service name: {}", sample);
            return false;
        }
        return true;
    }
}
