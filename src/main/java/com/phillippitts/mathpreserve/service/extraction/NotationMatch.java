package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;
import com.phillippitts.mathpreserve.domain.ExpressionRecord;

/**
 * Provisional candidate reported by one pattern family, before ordering.
 *
 * @param start absolute offset of the opening delimiter
 * @param end absolute offset just past the closing delimiter
 * @param rawNotation trimmed body
 * @param kind rendering class
 * @param delimiterTag delimiter or environment name
 * @param family name of the pattern family that produced the match
 */
public record NotationMatch(int start, int end, String rawNotation, ExpressionKind kind,
                            String delimiterTag, String family) {

    public NotationMatch {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid match span [" + start + ", " + end + ")");
        }
    }

    /**
     * True when this span lies inside {@code other} and the spans differ.
     */
    public boolean isNestedIn(NotationMatch other) {
        return other.start <= start && end <= other.end && (other.start != start || other.end != end);
    }

    public ExpressionRecord toRecord() {
        return ExpressionRecord.provisional(rawNotation, kind, delimiterTag, start);
    }
}
