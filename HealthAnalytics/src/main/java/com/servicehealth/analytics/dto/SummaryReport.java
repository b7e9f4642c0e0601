package com.servicehealth.analytics.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregation over the trailing summary window.
 */
@Value
@Builder
public class SummaryReport {

    /** Severity code -> count of anomalies in the window. */
    @Singular
    Map<String, Long> anomalyCounts;

    /** Ordered by average availability, highest first. */
    @Singular
    List<ServiceHealth> services;

    /** Classification code -> count of predictions in the window. */
    @Singular
    Map<String, Long> predictionCounts;

    DataQuality dataQuality;

    Instant generatedAt;

    @Value
    @Builder
    public static class ServiceHealth {
        String serviceName;
        Double avgAvailability;
        Double avgPerformance;
    }

    @Value
    @Builder
    public static class DataQuality {
        long totalSamples;
        long distinctServices;
        Instant oldestSample;
        Instant newestSample;
    }

    public static SummaryReport empty(Instant generatedAt) {
        return SummaryReport.builder()
            .dataQuality(DataQuality.builder().build())
            .generatedAt(generatedAt)
            .build();
    }
}
