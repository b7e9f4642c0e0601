package com.servicehealth.analytics.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendClassification {

    DECLINING("declining"),
    IMPROVING("improving"),
    STABLE("stable");

    private final String code;

    TrendClassification(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
