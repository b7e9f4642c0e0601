package com.servicehealth.analytics.service;

import com.servicehealth.analytics.config.AnalyticsProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionSchedulerTest {

    @Mock
    private AnalyticsFacade analyticsFacade;

    private AnalyticsProperties properties;
    private RetentionScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AnalyticsProperties();
        scheduler = new RetentionScheduler(analyticsFacade, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void runCleanupUsesConfiguredRetention() {
        properties.getRetention().setDaysToKeep(7);
        when(analyticsFacade.cleanupOldData(7)).thenReturn(12);

        scheduler.runCleanup();

        verify(analyticsFacade).cleanupOldData(7);
        assertThat(scheduler.getRuns()).isEqualTo(1);
    }

    @Test
    void startSchedulesPeriodicCleanup() {
        properties.getRetention().setInterval(Duration.ofMillis(20));

        scheduler.start();

        verify(analyticsFacade, timeout(2000).atLeast(2)).cleanupOldData(30);
    }

    @Test
    void startDoesNothingWhenRetentionDisabled() {
        properties.getRetention().setEnabled(false);
        properties.getRetention().setInterval(Duration.ofMillis(10));

        scheduler.start();

        verify(analyticsFacade, after(200).never()).cleanupOldData(30);
        assertThat(scheduler.getRuns()).isZero();
    }

    @Test
    void startDoesNothingWhenAnalyticsDisabled() {
        properties.setEnabled(false);
        properties.getRetention().setInterval(Duration.ofMillis(10));

        scheduler.start();

        verify(analyticsFacade, after(200).never()).cleanupOldData(30);
    }
}
