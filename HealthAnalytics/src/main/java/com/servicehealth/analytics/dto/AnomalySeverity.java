package com.servicehealth.analytics.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalySeverity {

    WARNING("warning"),
    CRITICAL("critical");

    private final String code;

    AnomalySeverity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
