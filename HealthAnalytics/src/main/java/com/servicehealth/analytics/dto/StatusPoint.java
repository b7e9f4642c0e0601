package com.servicehealth.analytics.dto;

import java.time.Instant;

/**
 * Status code of a stored sample and when it was observed.
 */
public record StatusPoint(String status, Instant timestamp) {
}
