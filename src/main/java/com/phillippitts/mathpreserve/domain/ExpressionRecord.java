package com.phillippitts.mathpreserve.domain;

import java.util.Objects;

/**
 * Immutable record of one notation expression found in the source text.
 *
 * <p>Main-flow records carry a dense {@code sequenceIndex} matching the order in which the renderer
 * emits expression nodes. Footnote-scoped records are rendered out of band and carry
 * {@link #UNSEQUENCED} instead.
 *
 * @param rawNotation expression body without delimiters, trimmed
 * @param kind rendering class of the expression
 * @param delimiterTag delimiter that introduced the expression ({@code $}, {@code $$}, {@code \[\]},
 *                     {@code \(\)}) or the environment name
 * @param sourceOffset absolute offset of the opening delimiter in the source text
 * @param sequenceIndex position in the main ordering, or {@link #UNSEQUENCED}
 * @param footnoteScoped whether the expression sits inside a footnote region
 */
public record ExpressionRecord(
        String rawNotation,
        ExpressionKind kind,
        String delimiterTag,
        int sourceOffset,
        int sequenceIndex,
        boolean footnoteScoped
) {

    public static final int UNSEQUENCED = -1;

    public ExpressionRecord {
        Objects.requireNonNull(rawNotation, "rawNotation");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(delimiterTag, "delimiterTag");
        if (sourceOffset < 0) {
            throw new IllegalArgumentException("sourceOffset must be >= 0");
        }
        if (sequenceIndex < UNSEQUENCED) {
            throw new IllegalArgumentException("sequenceIndex must be >= -1");
        }
        if (footnoteScoped && sequenceIndex != UNSEQUENCED) {
            throw new IllegalArgumentException("Footnote-scoped records are not sequenced");
        }
    }

    /**
     * Creates a provisional record that has not yet been ordered.
     */
    public static ExpressionRecord provisional(String rawNotation, ExpressionKind kind,
                                               String delimiterTag, int sourceOffset) {
        return new ExpressionRecord(rawNotation, kind, delimiterTag, sourceOffset, UNSEQUENCED, false);
    }

    public ExpressionRecord withSequenceIndex(int index) {
        return new ExpressionRecord(rawNotation, kind, delimiterTag, sourceOffset, index, false);
    }

    public ExpressionRecord asFootnoteScoped() {
        return new ExpressionRecord(rawNotation, kind, delimiterTag, sourceOffset, UNSEQUENCED, true);
    }

    public boolean isSequenced() {
        return sequenceIndex != UNSEQUENCED;
    }
}
