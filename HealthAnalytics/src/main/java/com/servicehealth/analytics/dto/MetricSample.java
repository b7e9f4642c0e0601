package com.servicehealth.analytics.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One health-check result for one service.
 * Scores are nullable because stored history may contain gaps; a null value
 * is excluded from the statistics of its own dimension only.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MetricSample {

    Instant timestamp;

    @NotBlank(message = "Service name is required")
    String serviceName;

    @NotBlank(message = "Status is required")
    String status;

    /** 0-100 */
    Double availabilityScore;

    Double performanceScore;

    /** Seconds. */
    Double responseTime;
}
