package com.servicehealth.analytics.config;

import com.servicehealth.analytics.util.ConfigValues;
import jakarta.annotation.PostConstruct;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed binding for all analytics.* configuration.
 * Out-of-range values are replaced by their defaults with a warning.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    public static final int DEFAULT_LEARNING_WINDOW_DAYS = 50;
    public static final int DEFAULT_MIN_SAMPLES = 20;
    public static final double DEFAULT_ANOMALY_THRESHOLD = 2.0;
    public static final int DEFAULT_PREDICTION_HORIZON_HOURS = 24;
    public static final Duration DEFAULT_BASELINE_TTL = Duration.ofMinutes(60);
    public static final int DEFAULT_BASELINE_REFRESH_SAMPLES = 100;

    /** Master switch. When false every analytics operation is a no-op. */
    private boolean enabled = true;

    /** Enables {@code detectAnomalies}. */
    private boolean anomalyDetection = true;

    /** Enables {@code generatePredictions}. */
    private boolean predictiveAnalysis = true;

    /** Trailing period (days) used for baselines and forecast history. */
    private int learningWindowDays = DEFAULT_LEARNING_WINDOW_DAYS;

    /** Samples required before a baseline is produced. */
    private int minSamples = DEFAULT_MIN_SAMPLES;

    /** Z-score above which a sample is flagged (strictly greater). */
    private double anomalyThreshold = DEFAULT_ANOMALY_THRESHOLD;

    /** Forecast horizon used when the caller does not give a valid one. */
    private int predictionHorizonHours = DEFAULT_PREDICTION_HORIZON_HOURS;

    /** Cached baselines older than this are recomputed. Zero disables expiry. */
    private Duration baselineTtl = DEFAULT_BASELINE_TTL;

    /** A cached baseline is dropped after this many new samples for its service. Zero disables. */
    private int baselineRefreshSamples = DEFAULT_BASELINE_REFRESH_SAMPLES;

    @Valid
    @NotNull
    private Retention retention = new Retention();

    @Data
    public static class Retention {

        public static final int DEFAULT_DAYS_TO_KEEP = 30;
        public static final Duration DEFAULT_INTERVAL = Duration.ofHours(24);

        private boolean enabled = true;

        /** Samples, anomalies and predictions older than this are deleted. */
        private int daysToKeep = DEFAULT_DAYS_TO_KEEP;

        /** Delay between two cleanup runs. */
        private Duration interval = DEFAULT_INTERVAL;
    }

    @PostConstruct
    public void sanitize() {
        learningWindowDays = ConfigValues.positiveOrDefault(
            learningWindowDays, DEFAULT_LEARNING_WINDOW_DAYS, "analytics.learning-window-days");
        minSamples = ConfigValues.positiveOrDefault(
            minSamples, DEFAULT_MIN_SAMPLES, "analytics.min-samples");
        anomalyThreshold = ConfigValues.positiveOrDefault(
            anomalyThreshold, DEFAULT_ANOMALY_THRESHOLD, "analytics.anomaly-threshold");
        predictionHorizonHours = ConfigValues.positiveOrDefault(
            predictionHorizonHours, DEFAULT_PREDICTION_HORIZON_HOURS, "analytics.prediction-horizon-hours");
        baselineTtl = ConfigValues.nonNegativeOrDefault(
            baselineTtl, DEFAULT_BASELINE_TTL, "analytics.baseline-ttl");
        baselineRefreshSamples = ConfigValues.nonNegativeOrDefault(
            baselineRefreshSamples, DEFAULT_BASELINE_REFRESH_SAMPLES, "analytics.baseline-refresh-samples");
        if (retention == null) {
            retention = new Retention();
        }
        retention.daysToKeep = ConfigValues.positiveOrDefault(
            retention.daysToKeep, Retention.DEFAULT_DAYS_TO_KEEP, "analytics.retention.days-to-keep");
        retention.interval = ConfigValues.positiveOrDefault(
            retention.interval, Retention.DEFAULT_INTERVAL, "analytics.retention.interval");
    }
}
