package com.phillippitts.mathpreserve.service.cleanup;

/**
 * Annotation coverage of a tree.
 *
 * @param expressionNodeCount rendered expression nodes
 * @param annotationCount preserved annotations
 * @param safe false when expressions exist but no annotation does
 */
public record LivenessStatus(int expressionNodeCount, int annotationCount, boolean safe) {

    public static LivenessStatus of(LivenessQuery query) {
        int expressions = query.expressionNodeCount();
        int annotations = query.annotationCount();
        return new LivenessStatus(expressions, annotations, expressions == 0 || annotations > 0);
    }

    /**
     * Annotations per expression node, 1.0 for a tree without expressions.
     */
    public double ratio() {
        return expressionNodeCount == 0 ? 1.0 : (double) annotationCount / expressionNodeCount;
    }
}
