package com.servicehealth.analytics.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A detected deviation for one service.
 * {@code affectedMetrics} keeps insertion order so that serialized payloads
 * are stable for identical input.
 */
@Value
@Builder
public class AnomalyRecord {

    Instant timestamp;
    String serviceName;
    AnomalyKind kind;
    AnomalySeverity severity;
    String description;

    /** 0-100 */
    double confidence;

    @Singular
    Map<String, Object> affectedMetrics;
}
