package com.servicehealth.analytics.service;

import com.servicehealth.analytics.config.AnalyticsProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically deletes analytics data older than the configured retention.
 */
@Slf4j
@Service
public class RetentionScheduler {

    private final AnalyticsFacade analyticsFacade;
    private final AnalyticsProperties properties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "analytics-retention");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicLong runs = new AtomicLong(0);

    public RetentionScheduler(AnalyticsFacade analyticsFacade, AnalyticsProperties properties) {
        this.analyticsFacade = analyticsFacade;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        AnalyticsProperties.Retention retention = properties.getRetention();
        if (!properties.isEnabled() || !retention.isEnabled()) {
            log.info("Analytics retention cleanup disabled");
            return;
        }
        long intervalMs = retention.getInterval().toMillis();
        log.info("Starting analytics retention cleanup: keep {} days, every {}",
            retention.getDaysToKeep(), retention.getInterval());
        scheduler.scheduleWithFixedDelay(this::runCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void stop() {
        scheduler.shutdownNow();
        log.info("Analytics retention cleanup stopped after {} runs", runs.get());
    }

    void runCleanup() {
        int deleted = analyticsFacade.cleanupOldData(properties.getRetention().getDaysToKeep());
        runs.incrementAndGet();
        log.debug("Retention run {} deleted {} samples", runs.get(), deleted);
    }

    long getRuns() {
        return runs.get();
    }
}
