package com.servicehealth.analytics.controller;

import com.servicehealth.analytics.config.AnalyticsProperties;
import com.servicehealth.analytics.dto.AnomalyRecord;
import com.servicehealth.analytics.dto.Baseline;
import com.servicehealth.analytics.dto.MetricSample;
import com.servicehealth.analytics.dto.PredictionRecord;
import com.servicehealth.analytics.dto.SummaryReport;
import com.servicehealth.analytics.service.AnalyticsFacade;
import com.servicehealth.analytics.util.ConfigValues;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API over the analytics engine, used by the polling loop, the
 * reporting command and the dashboard.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsFacade analyticsFacade;
    private final AnalyticsProperties properties;

    /**
     * Records a health sample.
     */
    @PostMapping("/samples")
    public ResponseEntity<Void> recordSample(@Valid @RequestBody MetricSample sample) {
        analyticsFacade.recordSample(sample);
        return ResponseEntity.accepted().build();
    }

    /**
     * Records a health sample and checks it against the service baseline.
     *
     * @return anomalies found for the sample, possibly none
     */
    @PostMapping("/samples/anomalies")
    public ResponseEntity<List<AnomalyRecord>> recordAndDetect(@Valid @RequestBody MetricSample sample) {
        analyticsFacade.recordSample(sample);
        return ResponseEntity.ok(analyticsFacade.detectAnomalies(sample));
    }

    /**
     * Trend forecasts for a service.
     *
     * @param hours forecast horizon; invalid values fall back to the configured default
     */
    @GetMapping("/services/{serviceName}/predictions")
    public ResponseEntity<List<PredictionRecord>> getPredictions(
            @PathVariable String serviceName,
            @RequestParam(required = false) String hours) {
        int horizon = ConfigValues.parsePositiveInt(hours, properties.getPredictionHorizonHours(), "hours");
        return ResponseEntity.ok(analyticsFacade.generatePredictions(serviceName, horizon));
    }

    @GetMapping("/services/{serviceName}/baseline")
    public ResponseEntity<Baseline> getBaseline(@PathVariable String serviceName) {
        return analyticsFacade.getBaseline(serviceName)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Summary of the trailing 24 hours.
     */
    @GetMapping("/summary")
    public ResponseEntity<SummaryReport> getSummary() {
        return ResponseEntity.ok(analyticsFacade.getSummary());
    }

    @PostMapping("/maintenance/cleanup")
    public ResponseEntity<Map<String, Integer>> cleanup(@RequestParam(required = false) String days) {
        int daysToKeep = ConfigValues.parsePositiveInt(days, properties.getRetention().getDaysToKeep(), "days");
        return ResponseEntity.ok(Map.of("deleted", analyticsFacade.cleanupOldData(daysToKeep)));
    }
}
