package com.servicehealth.analytics.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Dimension a trend forecast is computed for.
 */
public enum PredictionMetric {

    AVAILABILITY("availability"),
    PERFORMANCE("performance");

    private final String code;

    PredictionMetric(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
