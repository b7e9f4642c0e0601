package com.servicehealth.analytics.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicehealth.analytics.config.JacksonConfig;
import com.servicehealth.analytics.dto.AnomalyKind;
import com.servicehealth.analytics.dto.AnomalyRecord;
import com.servicehealth.analytics.dto.AnomalySeverity;
import com.servicehealth.analytics.dto.Baseline;
import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.StatusPoint;
import com.servicehealth.analytics.exception.MetricsStoreException;
import com.servicehealth.analytics.store.MetricsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private MetricsStore metricsStore;

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(metricsStore);
    }

    @Test
    void largeDropIsCriticalWithConfidenceCapped() {
        Baseline baseline = baseline(100.0, 2.0, 80.0, 0.0);

        List<AnomalyRecord> anomalies = detector.detect(sample(90.0, 80.0), baseline, 2.0);

        assertThat(anomalies).hasSize(1);
        AnomalyRecord anomaly = anomalies.get(0);
        assertThat(anomaly.getKind()).isEqualTo(AnomalyKind.AVAILABILITY_DROP);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(anomaly.getConfidence()).isEqualTo(100.0);
        assertThat(anomaly.getAffectedMetrics())
            .containsEntry("availability_score", 90.0)
            .containsEntry("z_score", 5.0);
        assertThat(anomaly.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    void zScoreEqualToThresholdIsNotFlagged() {
        Baseline baseline = baseline(100.0, 1.0, 80.0, 0.0);

        assertThat(detector.detectAvailabilityAnomaly(sample(98.0, 80.0), baseline, 2.0)).isEmpty();
    }

    @Test
    void zScoreJustAboveThresholdIsFlaggedAsWarning() {
        Baseline baseline = baseline(100.0, 1.0, 80.0, 0.0);

        AnomalyRecord anomaly = detector.detectAvailabilityAnomaly(sample(97.9999, 80.0), baseline, 2.0).orElseThrow();

        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
        assertThat(anomaly.getConfidence()).isCloseTo(66.67, within(0.01));
    }

    @Test
    void valueAboveMeanIsUnusualBehavior() {
        Baseline baseline = baseline(50.0, 5.0, 80.0, 0.0);

        AnomalyRecord anomaly = detector.detectAvailabilityAnomaly(sample(70.0, 80.0), baseline, 2.0).orElseThrow();

        assertThat(anomaly.getKind()).isEqualTo(AnomalyKind.UNUSUAL_BEHAVIOR);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
    }

    @Test
    void performanceDropIsDegradation() {
        Baseline baseline = baseline(99.0, 0.0, 80.0, 4.0);

        AnomalyRecord anomaly = detector.detectPerformanceAnomaly(sample(99.0, 70.0), baseline, 2.0).orElseThrow();

        assertThat(anomaly.getKind()).isEqualTo(AnomalyKind.PERFORMANCE_DEGRADATION);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
        assertThat(anomaly.getConfidence()).isCloseTo(83.33, within(0.01));
        assertThat(anomaly.getAffectedMetrics()).containsEntry("performance_score", 70.0);
        assertThat(anomaly.getDescription()).isEqualTo("Performance anomaly detected: 70.0 (baseline: 80.0, z-score: 2.50)");
    }

    @Test
    void checksAreCumulative() {
        Baseline baseline = baseline(100.0, 2.0, 80.0, 4.0);

        List<AnomalyRecord> anomalies = detector.detect(sample(90.0, 70.0), baseline, 2.0);

        assertThat(anomalies).extracting(AnomalyRecord::getKind)
            .containsExactly(AnomalyKind.AVAILABILITY_DROP, AnomalyKind.PERFORMANCE_DEGRADATION);
    }

    @Test
    void zeroStandardDeviationIsSkipped() {
        Baseline baseline = baseline(100.0, 0.0, 80.0, 0.0);

        assertThat(detector.detect(sample(10.0, 10.0), baseline, 2.0)).isEmpty();
    }

    @Test
    void missingScoreIsSkipped() {
        Baseline baseline = baseline(100.0, 2.0, 80.0, 4.0);
        MetricSample sample = sample(90.0, 70.0).toBuilder().availabilityScore(null).build();

        assertThat(detector.detectAvailabilityAnomaly(sample, baseline, 2.0)).isEmpty();
    }

    @Test
    void threeDistinctStatusesAreFlapping() {
        List<StatusPoint> statuses = List.of(
            new StatusPoint("major_outage", NOW),
            new StatusPoint("degraded_performance", NOW.minusSeconds(300)),
            new StatusPoint("operational", NOW.minusSeconds(600)));

        AnomalyRecord anomaly = detector.evaluateFlapping(sample(99.0, 80.0), statuses).orElseThrow();

        assertThat(anomaly.getKind()).isEqualTo(AnomalyKind.SERVICE_FLAPPING);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
        assertThat(anomaly.getConfidence()).isEqualTo(75.0);
        assertThat(anomaly.getAffectedMetrics())
            .containsEntry("status_changes", 3)
            .containsEntry("current_status", "operational");
    }

    @Test
    void twoDistinctStatusesAreNotFlapping() {
        List<StatusPoint> statuses = List.of(
            new StatusPoint("operational", NOW),
            new StatusPoint("degraded_performance", NOW.minusSeconds(300)),
            new StatusPoint("operational", NOW.minusSeconds(600)),
            new StatusPoint("degraded_performance", NOW.minusSeconds(900)));

        assertThat(detector.evaluateFlapping(sample(99.0, 80.0), statuses)).isEmpty();
    }

    @Test
    void singleStatusSkipsFlappingCheck() {
        assertThat(detector.evaluateFlapping(sample(99.0, 80.0), List.of(new StatusPoint("operational", NOW))))
            .isEmpty();
    }

    @Test
    void flappingQueriesHourEndingAtSampleTimestamp() {
        when(metricsStore.queryRecentStatuses(anyString(), any(Instant.class), any(Instant.class), anyInt())).thenReturn(List.of(
            new StatusPoint("a", NOW), new StatusPoint("b", NOW), new StatusPoint("c", NOW)));

        List<AnomalyRecord> anomalies = detector.detect(sample(99.0, 80.0), baseline(99.0, 0.0, 80.0, 0.0), 2.0);

        assertThat(anomalies).extracting(AnomalyRecord::getKind).containsExactly(AnomalyKind.SERVICE_FLAPPING);
        verify(metricsStore).queryRecentStatuses("api", NOW.minus(Duration.ofHours(1)), NOW, 10);
    }

    @Test
    void storeFailureOnlySkipsFlapping() {
        when(metricsStore.queryRecentStatuses(anyString(), any(Instant.class), any(Instant.class), anyInt()))
            .thenThrow(new MetricsStoreException("connection refused"));

        List<AnomalyRecord> anomalies = detector.detect(sample(90.0, 80.0), baseline(100.0, 2.0, 80.0, 0.0), 2.0);

        assertThat(anomalies).extracting(AnomalyRecord::getKind).containsExactly(AnomalyKind.AVAILABILITY_DROP);
    }

    @Test
    void identicalInputGivesIdenticalPayload() throws Exception {
        ObjectMapper mapper = new JacksonConfig().objectMapper();
        Baseline baseline = baseline(100.0, 2.0, 80.0, 4.0);

        String first = mapper.writeValueAsString(detector.detect(sample(90.0, 70.0), baseline, 2.0));
        String second = mapper.writeValueAsString(detector.detect(sample(90.0, 70.0), baseline, 2.0));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void severeAvailabilityDropEndToEnd() {
        Baseline baseline = baseline(99.0, 0.5, 80.0, 0.0);

        List<AnomalyRecord> anomalies = detector.detect(sample(95.0, 80.0), baseline, 2.0);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getKind()).isEqualTo(AnomalyKind.AVAILABILITY_DROP);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(anomalies.get(0).getAffectedMetrics()).containsEntry("z_score", 8.0);
        assertThat(anomalies.get(0).getConfidence()).isEqualTo(100.0);
        assertThat(anomalies.get(0).getDescription())
            .isEqualTo("Availability anomaly detected: 95.0% (baseline: 99.0%, z-score: 8.00)");
    }

    private static MetricSample sample(Double availability, Double performance) {
        return MetricSample.builder()
            .timestamp(NOW)
            .serviceName("api")
            .status("operational")
            .availabilityScore(availability)
            .performanceScore(performance)
            .responseTime(0.4)
            .build();
    }

    private static Baseline baseline(double availabilityMean, double availabilityStd,
                                     double performanceMean, double performanceStd) {
        return Baseline.builder()
            .serviceName("api")
            .availabilityMean(availabilityMean)
            .availabilityStd(availabilityStd)
            .performanceMean(performanceMean)
            .performanceStd(performanceStd)
            .sampleCount(50)
            .computedAt(NOW)
            .build();
    }
}
