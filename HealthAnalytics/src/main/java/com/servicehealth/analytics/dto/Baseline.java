package com.servicehealth.analytics.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Per-service statistical summary over the learning window.
 * Standard deviations are sample (n-1) deviations, 0 when fewer than two values.
 */
@Value
@Builder
public class Baseline {

    String serviceName;
    double availabilityMean;
    double availabilityStd;
    double performanceMean;
    double performanceStd;
    double responseTimeMean;
    double responseTimeStd;
    int sampleCount;
    Instant computedAt;
}
