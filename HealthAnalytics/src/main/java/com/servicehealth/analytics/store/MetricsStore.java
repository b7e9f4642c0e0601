package com.servicehealth.analytics.store;

import com.servicehealth.analytics.dto.AnomalyRecord;
import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.MetricValues;
import com.servicehealth.analytics.dto.PredictionRecord;
import com.servicehealth.analytics.dto.StatusPoint;
import com.servicehealth.analytics.dto.SummaryReport;

import java.time.Instant;
import java.util.List;

/**
 * Time-series store of health samples and of the records derived from them.
 * Implementations signal failures with
 * {@link com.servicehealth.analytics.exception.MetricsStoreException}.
 */
public interface MetricsStore {

    void insertSample(MetricSample sample);

    /**
     * Numeric values of the most recent samples since {@code since}, newest first.
     */
    List<MetricValues> queryRecent(String serviceName, Instant since, int limit);

    /**
     * The most recent samples since {@code since}, returned oldest first.
     */
    List<MetricSample> queryHistory(String serviceName, Instant since, int limit);

    /**
     * Status codes of the most recent samples in {@code [since, until]}, newest first.
     */
    List<StatusPoint> queryRecentStatuses(String serviceName, Instant since, Instant until, int limit);

    void insertAnomaly(AnomalyRecord anomaly);

    void insertPrediction(PredictionRecord prediction);

    /**
     * Anomaly and prediction counts and per-service averages since {@code since};
     * data quality figures cover the whole store.
     */
    SummaryReport aggregateSummary(Instant since, Instant generatedAt);

    /**
     * Deletes samples, anomalies and predictions older than {@code cutoff}.
     *
     * @return number of deleted samples
     */
    int deleteOlderThan(Instant cutoff);
}
