package com.servicehealth.analytics.store;

import com.servicehealth.analytics.dto.AnomalyRecord;
import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.MetricValues;
import com.servicehealth.analytics.dto.PredictionRecord;
import com.servicehealth.analytics.dto.StatusPoint;
import com.servicehealth.analytics.dto.SummaryReport;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column mapping between the analytics tables and the engine types.
 * Rows are the attribute maps of the ActiveJDBC models or of {@code Base.findAll}.
 */
final class MetricRows {

    private MetricRows() {
    }

    // service_metrics

    static Map<String, Object> sampleColumns(MetricSample sample, String metadataJson) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("timestamp", Timestamp.from(sample.getTimestamp()));
        columns.put("service_name", sample.getServiceName());
        columns.put("status", sample.getStatus());
        columns.put("response_time", sample.getResponseTime());
        columns.put("availability_score", sample.getAvailabilityScore());
        columns.put("performance_score", sample.getPerformanceScore());
        columns.put("metadata", metadataJson);
        return columns;
    }

    static MetricValues toValues(Map<String, Object> row) {
        return new MetricValues(
            toDouble(row.get("availability_score")),
            toDouble(row.get("performance_score")),
            toDouble(row.get("response_time")));
    }

    static MetricSample toSample(Map<String, Object> row) {
        return MetricSample.builder()
            .timestamp(toInstant(row.get("timestamp")))
            .serviceName((String) row.get("service_name"))
            .status((String) row.get("status"))
            .availabilityScore(toDouble(row.get("availability_score")))
            .performanceScore(toDouble(row.get("performance_score")))
            .responseTime(toDouble(row.get("response_time")))
            .build();
    }

    /**
     * @param newestFirst rows as read by the recent-rows finder
     * @return the samples oldest first
     */
    static List<MetricSample> toHistory(List<Map<String, Object>> newestFirst) {
        List<MetricSample> history = new ArrayList<>(newestFirst.size());
        for (Map<String, Object> row : newestFirst) {
            history.add(toSample(row));
        }
        Collections.reverse(history);
        return history;
    }

    static StatusPoint toStatusPoint(Map<String, Object> row) {
        return new StatusPoint((String) row.get("status"), toInstant(row.get("timestamp")));
    }

    // anomalies

    static Map<String, Object> anomalyColumns(AnomalyRecord anomaly, String metadataJson) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("timestamp", Timestamp.from(anomaly.getTimestamp()));
        columns.put("service_name", anomaly.getServiceName());
        columns.put("anomaly_type", anomaly.getKind().getCode());
        columns.put("severity", anomaly.getSeverity().getCode());
        columns.put("description", anomaly.getDescription());
        columns.put("confidence_score", anomaly.getConfidence());
        columns.put("metadata", metadataJson);
        return columns;
    }

    // predictions

    /**
     * Metadata document of a prediction row: the predicted value keyed by metric,
     * the trend slope and the description.
     */
    static Map<String, Object> predictionMetadata(PredictionRecord prediction) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(prediction.getMetric().getCode(), prediction.getPredictedValue());
        metadata.put("trend_slope", prediction.getTrendSlope());
        metadata.put("description", prediction.getDescription());
        return metadata;
    }

    static Map<String, Object> predictionColumns(PredictionRecord prediction, String metadataJson) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("timestamp", Timestamp.from(prediction.getTimestamp()));
        columns.put("service_name", prediction.getServiceName());
        columns.put("prediction_type", prediction.getClassification().getCode());
        columns.put("prediction_value", prediction.getPredictedValue());
        columns.put("confidence_score", prediction.getConfidence());
        columns.put("time_horizon_hours", prediction.getHorizonHours());
        columns.put("metadata", metadataJson);
        return columns;
    }

    // summary

    static SummaryReport.ServiceHealth toServiceHealth(Map<String, Object> row) {
        return SummaryReport.ServiceHealth.builder()
            .serviceName((String) row.get("service_name"))
            .avgAvailability(toDouble(row.get("avg_availability")))
            .avgPerformance(toDouble(row.get("avg_performance")))
            .build();
    }

    static SummaryReport.DataQuality toDataQuality(Map<String, Object> row) {
        return SummaryReport.DataQuality.builder()
            .totalSamples(toLong(row.get("total_samples")))
            .distinctServices(toLong(row.get("distinct_services")))
            .oldestSample(toInstant(row.get("oldest_sample")))
            .newestSample(toInstant(row.get("newest_sample")))
            .build();
    }

    static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    static Double toDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : null;
    }

    static Instant toInstant(Object value) {
        if (value instanceof Timestamp ts) {
            return ts.toInstant();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atZone(ZoneId.systemDefault()).toInstant();
        }
        return null;
    }
}
