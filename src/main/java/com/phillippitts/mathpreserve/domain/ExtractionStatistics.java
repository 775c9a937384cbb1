package com.phillippitts.mathpreserve.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts of captured expressions by kind and by delimiter, over main-flow and footnote records.
 */
public record ExtractionStatistics(
        int total,
        int footnoteScoped,
        Map<ExpressionKind, Integer> byKind,
        Map<String, Integer> byDelimiter
) {

    public static final ExtractionStatistics EMPTY = of(List.of());

    public ExtractionStatistics {
        Map<ExpressionKind, Integer> kinds = new EnumMap<>(ExpressionKind.class);
        kinds.putAll(byKind);
        byKind = Collections.unmodifiableMap(kinds);
        byDelimiter = Collections.unmodifiableMap(new TreeMap<>(byDelimiter));
    }

    public static ExtractionStatistics of(Collection<ExpressionRecord> records) {
        Map<ExpressionKind, Integer> kinds = new EnumMap<>(ExpressionKind.class);
        Map<String, Integer> delimiters = new TreeMap<>();
        int footnotes = 0;
        for (ExpressionRecord r : records) {
            kinds.merge(r.kind(), 1, Integer::sum);
            delimiters.merge(r.delimiterTag(), 1, Integer::sum);
            if (r.footnoteScoped()) {
                footnotes++;
            }
        }
        return new ExtractionStatistics(records.size(), footnotes, kinds, delimiters);
    }

    public int count(ExpressionKind kind) {
        return byKind.getOrDefault(kind, 0);
    }
}
