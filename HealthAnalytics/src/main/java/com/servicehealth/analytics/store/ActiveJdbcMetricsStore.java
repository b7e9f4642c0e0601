package com.servicehealth.analytics.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicehealth.analytics.config.ActiveJDBCConfig;
import com.servicehealth.analytics.dto.AnomalyRecord;
import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.MetricValues;
import com.servicehealth.analytics.dto.PredictionRecord;
import com.servicehealth.analytics.dto.StatusPoint;
import com.servicehealth.analytics.dto.SummaryReport;
import com.servicehealth.analytics.exception.MetricsStoreException;
import com.servicehealth.analytics.model.Anomaly;
import com.servicehealth.analytics.model.Prediction;
import com.servicehealth.analytics.model.ServiceMetric;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.javalite.activejdbc.Model;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * PostgreSQL metrics store built on ActiveJDBC models.
 *
 * A connection is opened for the calling thread when it has none and closed
 * again once the operation completes.
 */
@Slf4j
@Component
public class ActiveJdbcMetricsStore implements MetricsStore {

    private static final String ANOMALY_COUNTS_SQL = """
        SELECT severity, COUNT(*) AS count
        FROM anomalies
        WHERE timestamp >= ?
        GROUP BY severity
        """;

    private static final String SERVICE_HEALTH_SQL = """
        SELECT service_name,
               AVG(availability_score) AS avg_availability,
               AVG(performance_score) AS avg_performance
        FROM service_metrics
        WHERE timestamp >= ?
        GROUP BY service_name
        ORDER BY avg_availability DESC
        """;

    private static final String PREDICTION_COUNTS_SQL = """
        SELECT prediction_type, COUNT(*) AS count
        FROM predictions
        WHERE timestamp >= ?
        GROUP BY prediction_type
        """;

    private static final String DATA_QUALITY_SQL = """
        SELECT COUNT(*) AS total_samples,
               COUNT(DISTINCT service_name) AS distinct_services,
               MIN(timestamp) AS oldest_sample,
               MAX(timestamp) AS newest_sample
        FROM service_metrics
        """;

    private final ActiveJDBCConfig activeJDBCConfig;
    private final ObjectMapper objectMapper;

    public ActiveJdbcMetricsStore(ActiveJDBCConfig activeJDBCConfig, ObjectMapper objectMapper) {
        this.activeJDBCConfig = activeJDBCConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insertSample(MetricSample sample) {
        inConnection("insert sample for " + sample.getServiceName(), () -> {
            ServiceMetric metric = new ServiceMetric();
            MetricRows.sampleColumns(sample, serializeToJson(sample)).forEach(metric::set);
            save(metric, "sample for " + sample.getServiceName());
            return null;
        });
    }

    @Override
    public List<MetricValues> queryRecent(String serviceName, Instant since, int limit) {
        return inConnection("query recent samples for " + serviceName, () -> {
            List<MetricValues> values = new ArrayList<>();
            for (ServiceMetric metric : ServiceMetric.findRecent(serviceName, since, limit)) {
                values.add(MetricRows.toValues(metric.toMap()));
            }
            return values;
        });
    }

    @Override
    public List<MetricSample> queryHistory(String serviceName, Instant since, int limit) {
        return inConnection("query history for " + serviceName, () -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            for (ServiceMetric metric : ServiceMetric.findRecent(serviceName, since, limit)) {
                rows.add(metric.toMap());
            }
            return MetricRows.toHistory(rows);
        });
    }

    @Override
    public List<StatusPoint> queryRecentStatuses(String serviceName, Instant since, Instant until, int limit) {
        return inConnection("query recent statuses for " + serviceName, () -> {
            List<StatusPoint> statuses = new ArrayList<>();
            for (ServiceMetric metric : ServiceMetric.findBetween(serviceName, since, until, limit)) {
                statuses.add(MetricRows.toStatusPoint(metric.toMap()));
            }
            return statuses;
        });
    }

    @Override
    public void insertAnomaly(AnomalyRecord anomaly) {
        inConnection("insert anomaly for " + anomaly.getServiceName(), () -> {
            Anomaly row = new Anomaly();
            MetricRows.anomalyColumns(anomaly, serializeToJson(anomaly.getAffectedMetrics())).forEach(row::set);
            save(row, "anomaly for " + anomaly.getServiceName());
            return null;
        });
    }

    @Override
    public void insertPrediction(PredictionRecord prediction) {
        inConnection("insert prediction for " + prediction.getServiceName(), () -> {
            String metadata = serializeToJson(MetricRows.predictionMetadata(prediction));
            Prediction row = new Prediction();
            MetricRows.predictionColumns(prediction, metadata).forEach(row::set);
            save(row, "prediction for " + prediction.getServiceName());
            return null;
        });
    }

    @Override
    public SummaryReport aggregateSummary(Instant since, Instant generatedAt) {
        return inConnection("aggregate summary", () -> {
            Timestamp sinceTs = Timestamp.from(since);
            SummaryReport.SummaryReportBuilder report = SummaryReport.builder().generatedAt(generatedAt);

            for (Map<String, Object> row : Base.findAll(ANOMALY_COUNTS_SQL, sinceTs)) {
                report.anomalyCount((String) row.get("severity"), MetricRows.toLong(row.get("count")));
            }

            for (Map<String, Object> row : Base.findAll(SERVICE_HEALTH_SQL, sinceTs)) {
                report.service(MetricRows.toServiceHealth(row));
            }

            for (Map<String, Object> row : Base.findAll(PREDICTION_COUNTS_SQL, sinceTs)) {
                report.predictionCount((String) row.get("prediction_type"), MetricRows.toLong(row.get("count")));
            }

            List<Map<String, Object>> quality = Base.findAll(DATA_QUALITY_SQL);
            report.dataQuality(quality.isEmpty()
                ? SummaryReport.DataQuality.builder().build()
                : MetricRows.toDataQuality(quality.get(0)));
            return report.build();
        });
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return inConnection("delete data older than " + cutoff, () -> {
            int samples = ServiceMetric.deleteOlderThan(cutoff);
            int anomalies = Anomaly.deleteOlderThan(cutoff);
            int predictions = Prediction.deleteOlderThan(cutoff);
            log.debug("Deleted rows older than {}: samples={}, anomalies={}, predictions={}",
                cutoff, samples, anomalies, predictions);
            return samples;
        });
    }

    private <T> T inConnection(String operation, Supplier<T> work) {
        boolean opened = false;
        try {
            opened = activeJDBCConfig.openConnection();
            return work.get();
        } catch (MetricsStoreException e) {
            throw e;
        } catch (Exception e) {
            throw new MetricsStoreException("Failed to " + operation, e);
        } finally {
            if (opened) {
                activeJDBCConfig.closeConnection();
            }
        }
    }

    private void save(Model model, String what) {
        if (!model.saveIt()) {
            throw new MetricsStoreException("Failed to save " + what + ", errors: " + model.errors());
        }
    }

    private String serializeToJson(Object obj) {
        if (obj == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize object to JSON: {}", e.getMessage());
            return null;
        }
    }
}
