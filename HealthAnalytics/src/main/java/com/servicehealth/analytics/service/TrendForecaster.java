package com.servicehealth.analytics.service;

import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.PredictionMetric;
import com.servicehealth.analytics.dto.PredictionRecord;
import com.servicehealth.analytics.dto.TrendClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Linear trend forecasts over a service's sample history.
 *
 * The regression x axis is the position of the sample in the chronologically
 * ordered history (0 = oldest), not elapsed time. The forecast point is
 * {@code n + horizonHours / 24 * 7}, n being the number of points fitted.
 */
@Slf4j
@Component
public class TrendForecaster {

    static final int MIN_HISTORY = 20;
    static final int MIN_POINTS = 10;
    static final int RECENT_POINTS = 10;
    static final double MIN_CONFIDENCE = 20.0;
    static final double MAX_CONFIDENCE = 100.0;

    /**
     * Per-dimension forecast settings.
     */
    enum Dimension {

        AVAILABILITY(PredictionMetric.AVAILABILITY, MetricSample::getAvailabilityScore, 0.1, 10.0),
        PERFORMANCE(PredictionMetric.PERFORMANCE, MetricSample::getPerformanceScore, 0.05, 5.0);

        final PredictionMetric metric;
        final Function<MetricSample, Double> extractor;
        final double slopeThreshold;
        final double volatilityPenalty;

        Dimension(PredictionMetric metric, Function<MetricSample, Double> extractor,
                  double slopeThreshold, double volatilityPenalty) {
            this.metric = metric;
            this.extractor = extractor;
            this.slopeThreshold = slopeThreshold;
            this.volatilityPenalty = volatilityPenalty;
        }
    }

    private final Clock clock;

    public TrendForecaster(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param history samples of one service, oldest first
     * @return one prediction per dimension with enough data; empty below {@value #MIN_HISTORY} samples
     */
    public List<PredictionRecord> predict(String serviceName, List<MetricSample> history, int horizonHours) {
        List<PredictionRecord> predictions = new ArrayList<>();
        if (history.size() < MIN_HISTORY) {
            log.debug("Insufficient history for predictions: service={}, samples={}", serviceName, history.size());
            return predictions;
        }

        Instant generatedAt = clock.instant();
        for (Dimension dimension : Dimension.values()) {
            forecast(serviceName, history, horizonHours, dimension, generatedAt).ifPresent(predictions::add);
        }
        return predictions;
    }

    Optional<PredictionRecord> forecast(String serviceName, List<MetricSample> history, int horizonHours,
                                        Dimension dimension, Instant generatedAt) {
        List<Double> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (int i = 0; i < history.size(); i++) {
            Double value = dimension.extractor.apply(history.get(i));
            if (value != null) {
                xs.add((double) i);
                ys.add(value);
            }
        }

        int n = ys.size();
        if (n < MIN_POINTS) {
            log.debug("Skipping {} forecast for {}: only {} points", dimension.metric.getCode(), serviceName, n);
            return Optional.empty();
        }

        Statistics.LinearFit fit = Statistics.leastSquares(toArray(xs), toArray(ys));
        double futureX = n + (horizonHours / 24.0 * 7);
        double predicted = fit.valueAt(futureX);

        double recentStd = Statistics.standardDeviation(ys.subList(n - RECENT_POINTS, n));
        double confidence = Math.min(MAX_CONFIDENCE,
            Math.max(MIN_CONFIDENCE, 100 - recentStd * dimension.volatilityPenalty));

        TrendClassification classification = classify(fit.slope(), dimension.slopeThreshold);

        return Optional.of(PredictionRecord.builder()
            .timestamp(generatedAt)
            .serviceName(serviceName)
            .metric(dimension.metric)
            .predictedValue(predicted)
            .trendSlope(fit.slope())
            .confidence(confidence)
            .horizonHours(horizonHours)
            .classification(classification)
            .description(describe(dimension.metric, classification, predicted, horizonHours))
            .build());
    }

    static TrendClassification classify(double slope, double threshold) {
        if (slope < -threshold) {
            return TrendClassification.DECLINING;
        }
        if (slope > threshold) {
            return TrendClassification.IMPROVING;
        }
        return TrendClassification.STABLE;
    }

    private static String describe(PredictionMetric metric, TrendClassification classification,
                                   double predicted, int horizonHours) {
        if (metric == PredictionMetric.AVAILABILITY) {
            String trend = switch (classification) {
                case DECLINING -> "Availability trend declining";
                case IMPROVING -> "Availability trend improving";
                case STABLE -> "Availability stable";
            };
            return String.format(Locale.ROOT, "%s. Predicted: %.1f%% in %dh", trend, predicted, horizonHours);
        }
        String trend = switch (classification) {
            case DECLINING -> "Performance declining";
            case IMPROVING -> "Performance improving";
            case STABLE -> "Performance stable";
        };
        return String.format(Locale.ROOT, "%s. Predicted score: %.1f in %dh", trend, predicted, horizonHours);
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
