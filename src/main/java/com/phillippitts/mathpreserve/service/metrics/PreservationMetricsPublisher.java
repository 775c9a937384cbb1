package com.phillippitts.mathpreserve.service.metrics;

import com.phillippitts.mathpreserve.service.cleanup.CleanupCategory;
import com.phillippitts.mathpreserve.service.cleanup.CleanupReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Null-safe facade over {@link PreservationMetrics} for the coordinator and cleanup.
 *
 * <p>All methods are no-ops when constructed without metrics, so components can run in unit
 * tests through {@link #NOOP}.
 */
@Component
public final class PreservationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PreservationMetricsPublisher.class);

    /**
     * Singleton no-op instance for test environments.
     */
    public static final PreservationMetricsPublisher NOOP = new PreservationMetricsPublisher(null);

    private final PreservationMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public PreservationMetricsPublisher(PreservationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PreservationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(String method, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(method, durationNanos);
        metrics.incrementSuccess(method);
    }

    public void recordFallback(String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFallback(reason);
    }

    public void recordFailure(String method) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(method);
    }

    /**
     * Records removals and preserved counts of a performed pass, or the deferral of a skipped one.
     */
    public void recordCleanup(CleanupReport report) {
        if (metrics == null) {
            return;
        }
        if (!report.performed()) {
            metrics.incrementDeferred();
            return;
        }
        for (Map.Entry<CleanupCategory, Integer> entry : report.removed().entrySet()) {
            if (entry.getValue() > 0) {
                metrics.recordRemoved(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
            }
        }
        if (report.preserved() > 0) {
            metrics.recordPreserved(report.preserved());
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
