package com.phillippitts.mathpreserve.service.capture.event;

import java.time.Instant;

/**
 * Published after a capture pass installed a new registry generation.
 *
 * @param generation installed generation
 * @param expressionCount main-flow expressions
 * @param footnoteCount footnote-scoped expressions
 * @param warningCount integrity warnings raised during extraction
 * @param at capture time
 */
public record NotationCapturedEvent(long generation, int expressionCount, int footnoteCount,
                                    int warningCount, Instant at) {
}
