package com.phillippitts.mathpreserve.service.cleanup;

import com.phillippitts.mathpreserve.config.SchedulingConfig;
import com.phillippitts.mathpreserve.config.properties.CleanupProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Caller that re-invokes a deferred cleanup pass after a delay.
 *
 * <p>The tree supplier is asked for a fresh view on every attempt, so a retry sees annotations
 * the renderer injected in the meantime. After {@code preserve.cleanup.max-retries} deferred
 * attempts the last deferred report is returned as is.
 *
 * <p>Library entry point for hosts that hold a live render tree, where the renderer may still be
 * injecting annotations. The REST cleanup endpoint works on a posted snapshot and calls
 * {@link RenderTreeCleaner} directly.
 */
@Component
public class CleanupRetryScheduler {

    private static final Logger LOG = LogManager.getLogger(CleanupRetryScheduler.class);

    private final RenderTreeCleaner cleaner;
    private final TaskScheduler scheduler;
    private final CleanupProperties props;

    public CleanupRetryScheduler(RenderTreeCleaner cleaner,
                                 @Qualifier("cleanupScheduler") TaskScheduler scheduler,
                                 CleanupProperties props) {
        this.cleaner = Objects.requireNonNull(cleaner, "cleaner");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Runs a pass now and, while it is deferred and retries remain, again after the configured delay.
     *
     * @param trees supplies the live tree for each attempt
     * @return completes with the first performed report, or the last deferred one
     */
    public <N> CompletableFuture<CleanupReport> cleanWithRetry(Supplier<? extends RenderTree<N>> trees) {
        CompletableFuture<CleanupReport> result = new CompletableFuture<>();
        attempt(trees, 0, result);
        return result;
    }

    private <N> void attempt(Supplier<? extends RenderTree<N>> trees, int retriesUsed,
                             CompletableFuture<CleanupReport> result) {
        CleanupReport report;
        try {
            report = cleaner.performComprehensiveCleanup(trees.get());
        } catch (RuntimeException e) {
            LOG.warn("Cleanup attempt {} failed: {}", retriesUsed + 1, e.toString());
            result.completeExceptionally(e);
            return;
        }
        if (report.performed() || retriesUsed >= props.getMaxRetries()) {
            result.complete(report);
            return;
        }
        LOG.debug("Cleanup deferred ({}), retrying in {}", report.reason(), props.getRetryDelay());
        Runnable retry = SchedulingConfig.mdcPropagating().decorate(() -> attempt(trees, retriesUsed + 1, result));
        scheduler.schedule(retry, Instant.now().plus(props.getRetryDelay()));
    }
}
