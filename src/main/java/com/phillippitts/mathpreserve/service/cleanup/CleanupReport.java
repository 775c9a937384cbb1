package com.phillippitts.mathpreserve.service.cleanup;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of one cleanup pass.
 *
 * @param performed false when the pass was deferred
 * @param reason deferral reason, null when performed
 * @param removed nodes removed per category
 * @param preserved candidates skipped because they carried an annotation at removal time
 * @param cacheCleared whether renderer caches were dropped
 * @param memoryHintApplied whether a memory-reclamation hint was issued
 * @param liveness annotation coverage observed before the pass
 * @param health tree health after the pass, null when deferred
 */
public record CleanupReport(
        boolean performed,
        String reason,
        Map<CleanupCategory, Integer> removed,
        int preserved,
        boolean cacheCleared,
        boolean memoryHintApplied,
        LivenessStatus liveness,
        TreeHealth health
) {

    public static final String ANNOTATION_PROTECTION = "Annotation protection";

    public CleanupReport {
        Map<CleanupCategory, Integer> copy = new EnumMap<>(CleanupCategory.class);
        for (CleanupCategory category : CleanupCategory.values()) {
            copy.put(category, removed == null ? 0 : removed.getOrDefault(category, 0));
        }
        removed = Collections.unmodifiableMap(copy);
    }

    public static CleanupReport deferred(String reason, LivenessStatus liveness) {
        return new CleanupReport(false, reason, Map.of(), 0, false, false, liveness, null);
    }

    public int totalRemoved() {
        return removed.values().stream().mapToInt(Integer::intValue).sum();
    }
}
