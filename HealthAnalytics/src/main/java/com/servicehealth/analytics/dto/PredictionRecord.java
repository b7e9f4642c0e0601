package com.servicehealth.analytics.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A linear trend forecast for one dimension of one service.
 */
@Value
@Builder
public class PredictionRecord {

    Instant timestamp;
    String serviceName;
    PredictionMetric metric;
    double predictedValue;
    double trendSlope;

    /** 20-100, lowered by recent volatility. */
    double confidence;

    int horizonHours;
    TrendClassification classification;
    String description;
}
