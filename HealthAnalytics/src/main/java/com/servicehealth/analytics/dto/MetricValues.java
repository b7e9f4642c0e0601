package com.servicehealth.analytics.dto;

/**
 * The numeric columns of a stored sample, as read for baseline computation.
 */
public record MetricValues(Double availabilityScore, Double performanceScore, Double responseTime) {
}
