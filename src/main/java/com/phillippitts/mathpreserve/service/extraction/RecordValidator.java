package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionKind;
import com.phillippitts.mathpreserve.domain.ExpressionRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks over a record set: delimiter tags agree with kinds, notation is non-blank
 * and the main-flow numbering is dense and follows source order.
 */
public final class RecordValidator {

    private static final Set<String> INLINE_TAGS = Set.of(SingleDollarPattern.TAG, ParenInlinePattern.TAG);
    private static final Set<String> DISPLAY_TAGS = Set.of(DoubleDollarPattern.TAG, BracketDisplayPattern.TAG);

    private RecordValidator() {
    }

    /**
     * Validates an index-keyed record map.
     *
     * @return problems found, empty when the map is valid
     */
    public static List<String> validate(Map<Integer, ExpressionRecord> byIndex) {
        List<String> problems = new ArrayList<>();
        if (byIndex == null) {
            problems.add("record map is null");
            return problems;
        }
        int previousOffset = -1;
        for (int i = 0; i < byIndex.size(); i++) {
            ExpressionRecord record = byIndex.get(i);
            if (record == null) {
                problems.add("missing record at index " + i);
                continue;
            }
            if (record.sequenceIndex() != i) {
                problems.add("record keyed " + i + " carries index " + record.sequenceIndex());
            }
            if (record.rawNotation().isBlank()) {
                problems.add("blank notation at index " + i);
            }
            if (!tagMatchesKind(record.kind(), record.delimiterTag())) {
                problems.add("delimiter " + record.delimiterTag() + " inconsistent with kind " + record.kind()
                        + " at index " + i);
            }
            if (record.sourceOffset() <= previousOffset) {
                problems.add("offset not increasing at index " + i);
            }
            previousOffset = record.sourceOffset();
        }
        return problems;
    }

    static boolean tagMatchesKind(ExpressionKind kind, String tag) {
        return switch (kind) {
            case INLINE -> INLINE_TAGS.contains(tag);
            case DISPLAY -> DISPLAY_TAGS.contains(tag);
            case ENVIRONMENT -> !INLINE_TAGS.contains(tag) && !DISPLAY_TAGS.contains(tag) && !tag.isBlank();
        };
    }
}
