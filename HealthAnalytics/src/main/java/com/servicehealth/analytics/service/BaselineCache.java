package com.servicehealth.analytics.service;

import com.servicehealth.analytics.dto.Baseline;

import java.util.function.Supplier;

/**
 * Per-service baseline cache.
 * Only successful computations are cached; insufficient data and failures
 * are recomputed on the next request.
 */
public interface BaselineCache {

    /**
     * Returns the cached baseline of {@code serviceName}, or runs {@code loader}
     * and caches its value when it succeeds. Concurrent first requests for the
     * same service run the loader once.
     */
    AnalysisResult<Baseline> getOrCompute(String serviceName, Supplier<AnalysisResult<Baseline>> loader);

    /**
     * Signals a newly recorded sample, used for sample-count based refresh.
     */
    void onSampleRecorded(String serviceName);

    void invalidateAll();
}
