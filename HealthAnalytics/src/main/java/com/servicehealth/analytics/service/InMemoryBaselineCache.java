package com.servicehealth.analytics.service;

import com.servicehealth.analytics.dto.Baseline;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local baseline cache.
 *
 * An entry is recomputed once it is older than {@code ttl} or once
 * {@code refreshAfterSamples} new samples have been recorded for its service.
 * A zero ttl or refresh count disables that trigger.
 *
 * Loading runs under a per-service lock, outside the map, so a slow store
 * query only delays callers asking for the same service.
 */
@Slf4j
public class InMemoryBaselineCache implements BaselineCache {

    private record Entry(Baseline baseline, Instant cachedAt, int samplesSinceCached) {

        Entry withRecordedSample() {
            return new Entry(baseline, cachedAt, samplesSinceCached + 1);
        }
    }

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> loadLocks = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int refreshAfterSamples;
    private final Clock clock;

    public InMemoryBaselineCache(Duration ttl, int refreshAfterSamples, Clock clock) {
        this.ttl = ttl;
        this.refreshAfterSamples = refreshAfterSamples;
        this.clock = clock;
    }

    @Override
    public AnalysisResult<Baseline> getOrCompute(String serviceName, Supplier<AnalysisResult<Baseline>> loader) {
        Entry cached = freshEntry(serviceName);
        if (cached != null) {
            return AnalysisResult.ok(cached.baseline());
        }

        ReentrantLock lock = loadLocks.computeIfAbsent(serviceName, key -> new ReentrantLock());
        lock.lock();
        try {
            // another caller may have loaded it while we waited
            cached = freshEntry(serviceName);
            if (cached != null) {
                return AnalysisResult.ok(cached.baseline());
            }

            AnalysisResult<Baseline> result = loader.get();
            if (result.isOk()) {
                entries.put(serviceName, new Entry(result.getValue(), clock.instant(), 0));
                log.debug("Cached baseline for {} (samples={})", serviceName, result.getValue().getSampleCount());
            } else {
                entries.remove(serviceName);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onSampleRecorded(String serviceName) {
        if (refreshAfterSamples <= 0) {
            return;
        }
        entries.computeIfPresent(serviceName, (key, existing) -> {
            Entry updated = existing.withRecordedSample();
            if (updated.samplesSinceCached() >= refreshAfterSamples) {
                log.debug("Baseline for {} dropped after {} new samples", key, updated.samplesSinceCached());
                return null;
            }
            return updated;
        });
    }

    @Override
    public void invalidateAll() {
        entries.clear();
    }

    int size() {
        return entries.size();
    }

    private Entry freshEntry(String serviceName) {
        Entry entry = entries.get(serviceName);
        if (entry == null || isStale(entry)) {
            return null;
        }
        return entry;
    }

    private boolean isStale(Entry entry) {
        if (ttl.isZero()) {
            return false;
        }
        return !clock.instant().isBefore(entry.cachedAt().plus(ttl));
    }
}
