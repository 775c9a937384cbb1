package com.phillippitts.mathpreserve.service.cleanup;

/**
 * Kinds of render-tree nodes cleanup may remove.
 */
public enum CleanupCategory {
    /** Processing markers and temporary nodes left behind by conversion. */
    TEMPORARY,
    /** Rendered expression nodes outside the output region. */
    ORPHANED_EXPRESSION,
    /** Empty unnamed containers. */
    EMPTY
}
