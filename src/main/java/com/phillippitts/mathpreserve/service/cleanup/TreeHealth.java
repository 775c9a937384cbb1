package com.phillippitts.mathpreserve.service.cleanup;

import java.util.List;

/**
 * Operator-facing health assessment of a render tree. Diagnostic only; cleanup decisions never
 * depend on it.
 */
public record TreeHealth(
        boolean healthy,
        List<String> warnings,
        int totalNodes,
        int temporaryNodes,
        int emptyNodes,
        int expressionNodes,
        int annotations,
        double annotationRatio
) {

    public TreeHealth {
        warnings = List.copyOf(warnings);
    }
}
