package com.phillippitts.mathpreserve.service.cleanup;

/**
 * Read-only counts over a live render tree. Every call reflects the tree as it is now.
 */
public interface LivenessQuery {

    /** Rendered expression nodes anywhere in the tree. */
    int expressionNodeCount();

    /** Preserved annotations anywhere in the tree. */
    int annotationCount();
}
