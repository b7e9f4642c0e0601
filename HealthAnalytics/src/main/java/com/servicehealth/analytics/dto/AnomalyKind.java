package com.servicehealth.analytics.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyKind {

    AVAILABILITY_DROP("availability_drop"),
    PERFORMANCE_DEGRADATION("performance_degradation"),
    UNUSUAL_BEHAVIOR("unusual_behavior"),
    SERVICE_FLAPPING("service_flapping");

    private final String code;

    AnomalyKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
