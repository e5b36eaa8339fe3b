package com.platform.updater.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for updater metrics.
 * 
 * Naming: updater.{subsystem}.{metric}
 * Kind tags carry the resource kind only, never object names.
 */
@Slf4j
@Component
public class UpdaterMetrics {
    
    public static final String OUTCOME_SUCCEEDED = "succeeded";
    public static final String OUTCOME_DEFERRED = "deferred";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_CANCELLED = "cancelled";
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final AtomicInteger syncRunning = new AtomicInteger(0);
    private final Timer payloadDuration;
    
    public UpdaterMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.payloadDuration = Timer.builder("updater.payload.apply.duration")
            .description("Time spent applying a whole payload")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
        
        Gauge.builder("updater.sync.running", syncRunning, AtomicInteger::get)
            .description("1 while a sync is applying a payload")
            .register(meterRegistry);
        
        log.info("Updater metrics initialized");
    }
    
    /**
     * Record one apply attempt for a manifest of the given kind.
     */
    public void recordApplyAttempt(String kind) {
        incrementCounter("updater.apply.attempts", "kind", kind);
    }
    
    /**
     * Record the outcome of a manifest: succeeded, deferred or failed.
     */
    public void recordManifestOutcome(String kind, String outcome) {
        incrementCounter("updater.apply.manifests", "kind", kind, "outcome", outcome);
    }
    
    /**
     * Record the outcome of a whole sync.
     */
    public void recordSyncOutcome(String outcome) {
        incrementCounter("updater.sync.total", "outcome", outcome);
    }
    
    public void recordPayloadDuration(Duration duration) {
        payloadDuration.record(duration);
    }
    
    public void setSyncRunning(boolean running) {
        syncRunning.set(running ? 1 : 0);
    }
    
    /**
     * Record an error code surfaced through the REST API.
     */
    public void recordApiError(String code, boolean fatal) {
        incrementCounter("updater.api.errors", "code", code, "fatal", String.valueOf(fatal));
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Current count of a counter, 0 if it was never incremented.
     */
    public double count(String name, String... tags) {
        Counter counter = counters.get(name + String.join(".", tags));
        return counter != null ? counter.count() : 0.0;
    }
}
