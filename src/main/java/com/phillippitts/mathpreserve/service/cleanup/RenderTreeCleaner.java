package com.phillippitts.mathpreserve.service.cleanup;

import com.phillippitts.mathpreserve.config.properties.CleanupProperties;
import com.phillippitts.mathpreserve.service.metrics.PreservationMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Liveness-aware render-tree cleanup.
 *
 * <p>Removes temporary nodes, orphaned rendered expressions and empty containers, but never a
 * node that carries a preserved annotation. The annotation count of each candidate is read from
 * the live tree immediately before its removal; a nonzero count keeps the node and counts it as
 * preserved.
 *
 * <p>If the tree holds rendered expressions but no annotation at all, annotation injection has
 * most likely not finished yet and the whole pass is deferred. Deferral is a normal outcome: this
 * class never waits or retries, see {@link CleanupRetryScheduler} for a caller that does.
 *
 * <p>Cleanup does not read or write the notation registry.
 */
@Service
public class RenderTreeCleaner {

    private static final Logger LOG = LogManager.getLogger(RenderTreeCleaner.class);

    private static final List<CleanupCategory> ORDER = List.of(
            CleanupCategory.TEMPORARY, CleanupCategory.ORPHANED_EXPRESSION, CleanupCategory.EMPTY);

    private final CleanupProperties props;
    private final MemoryReclaimer reclaimer;
    private final PreservationMetricsPublisher metrics;

    public RenderTreeCleaner(CleanupProperties props, MemoryReclaimer reclaimer,
                             PreservationMetricsPublisher metrics) {
        this.props = Objects.requireNonNull(props, "props");
        this.reclaimer = Objects.requireNonNull(reclaimer, "reclaimer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Reports annotation coverage without changing the tree.
     */
    public LivenessStatus checkLiveness(LivenessQuery query) {
        return LivenessStatus.of(query);
    }

    /**
     * Runs one cleanup pass.
     *
     * @param tree live tree
     * @return deferred report when liveness cannot be confirmed, otherwise removal counts and health
     */
    public <N> CleanupReport performComprehensiveCleanup(RenderTree<N> tree) {
        Objects.requireNonNull(tree, "tree");
        LivenessStatus liveness = checkLiveness(tree);
        if (!liveness.safe()) {
            LOG.info("Cleanup deferred: {} expression nodes, no annotations yet", liveness.expressionNodeCount());
            CleanupReport report = CleanupReport.deferred(CleanupReport.ANNOTATION_PROTECTION, liveness);
            metrics.recordCleanup(report);
            return report;
        }

        Map<CleanupCategory, Integer> removed = new EnumMap<>(CleanupCategory.class);
        int preserved = 0;
        for (CleanupCategory category : ORDER) {
            int count = 0;
            for (N node : tree.findCandidates(category)) {
                if (tree.liveAnnotationCount(node) > 0) {
                    preserved++;
                    continue;
                }
                if (tree.remove(node)) {
                    count++;
                }
            }
            removed.put(category, count);
        }

        boolean cacheCleared = false;
        if (tree.outputExpressionCount() == 0) {
            cacheCleared = tree.clearRendererCache();
        }

        int total = removed.values().stream().mapToInt(Integer::intValue).sum();
        boolean hinted = props.isMemoryHintEnabled() && total > 0 && requestReclamation();

        CleanupReport report = new CleanupReport(true, null, removed, preserved, cacheCleared, hinted,
                liveness, assessHealth(tree));
        LOG.info("Cleanup removed {} nodes {} (preserved={}, cacheCleared={})",
                total, removed, preserved, cacheCleared);
        metrics.recordCleanup(report);
        return report;
    }

    private boolean requestReclamation() {
        try {
            return reclaimer.requestReclamation();
        } catch (RuntimeException e) {
            LOG.debug("Memory reclamation hint failed: {}", e.toString());
            return false;
        }
    }

    /**
     * Assesses tree health against the configured thresholds.
     */
    public <N> TreeHealth assessHealth(RenderTree<N> tree) {
        int totalNodes = tree.totalNodeCount();
        int temporary = tree.findCandidates(CleanupCategory.TEMPORARY).size();
        int empty = tree.findCandidates(CleanupCategory.EMPTY).size();
        LivenessStatus liveness = LivenessStatus.of(tree);

        boolean healthy = true;
        List<String> warnings = new ArrayList<>();
        if (totalNodes > props.getMaxTotalNodes()) {
            healthy = false;
            warnings.add("High node count: " + totalNodes);
        }
        if (temporary > props.getMaxTemporaryNodes()) {
            warnings.add("Temporary nodes accumulating: " + temporary);
        }
        if (!liveness.safe()) {
            warnings.add("Expression nodes present without annotations");
        }
        if (empty > props.getMaxEmptyNodes()) {
            warnings.add("Many empty nodes: " + empty);
        }
        return new TreeHealth(healthy, warnings, totalNodes, temporary, empty,
                liveness.expressionNodeCount(), liveness.annotationCount(), liveness.ratio());
    }
}
