package com.phillippitts.mathpreserve.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the preservation pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Reconstruction latency and outcome per strategy</li>
 *   <li>Fallbacks from the enhanced to the legacy strategy</li>
 *   <li>Cleanup removals per category, preserved candidates and deferred passes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PreservationMetrics {

    private static final String RECONSTRUCTION = "mathpreserve.reconstruction";
    private static final String CLEANUP = "mathpreserve.cleanup";

    private final MeterRegistry registry;

    public PreservationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records reconstruction latency for a strategy.
     *
     * @param method strategy label (enhanced, legacy)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String method, long durationNanos) {
        Timer.builder(RECONSTRUCTION + ".latency")
                .description("Time taken to reconstruct notation")
                .tag("method", method)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String method) {
        Counter.builder(RECONSTRUCTION + ".success")
                .description("Number of successful reconstructions")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    /**
     * Increments the fallback counter.
     *
     * @param reason why the enhanced strategy was abandoned (unavailable, sentinel, error)
     */
    public void incrementFallback(String reason) {
        Counter.builder(RECONSTRUCTION + ".fallback")
                .description("Number of fallbacks from enhanced to legacy")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementFailure(String method) {
        Counter.builder(RECONSTRUCTION + ".failure")
                .description("Number of failed reconstructions")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    public void recordRemoved(String category, int count) {
        Counter.builder(CLEANUP + ".removed")
                .description("Render-tree nodes removed by cleanup")
                .tag("category", category)
                .register(registry)
                .increment(count);
    }

    public void recordPreserved(int count) {
        Counter.builder(CLEANUP + ".preserved")
                .description("Cleanup candidates kept because they carried an annotation")
                .register(registry)
                .increment(count);
    }

    public void incrementDeferred() {
        Counter.builder(CLEANUP + ".deferred")
                .description("Cleanup passes deferred by annotation protection")
                .register(registry)
                .increment();
    }
}
