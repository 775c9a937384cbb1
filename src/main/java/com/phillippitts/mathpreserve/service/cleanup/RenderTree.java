package com.phillippitts.mathpreserve.service.cleanup;

import java.util.List;

/**
 * Mutable view of a render tree as seen by cleanup.
 *
 * @param <N> node handle type
 */
public interface RenderTree<N> extends LivenessQuery {

    /**
     * Current removal candidates of one category, in document order.
     */
    List<N> findCandidates(CleanupCategory category);

    /**
     * Preserved annotations carried by the node or its descendants, evaluated against the live tree.
     */
    int liveAnnotationCount(N node);

    /**
     * Detaches the node.
     *
     * @return false if the node was already detached
     */
    boolean remove(N node);

    int totalNodeCount();

    /** Rendered expression nodes inside the designated output region. */
    int outputExpressionCount();

    /**
     * Drops renderer-side caches tied to this tree.
     *
     * @return true if anything was cleared
     */
    boolean clearRendererCache();
}
