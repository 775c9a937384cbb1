package com.phillippitts.mathpreserve.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one extraction pass.
 *
 * @param records main-flow records ordered by {@code sequenceIndex}
 * @param footnoteRecords footnote-scoped records ordered by source offset
 * @param footnoteRegions well-formed footnote regions found in the source
 * @param integrityWarnings non-fatal data-integrity issues observed during the pass
 * @param statistics counts over all records
 */
public record ExtractionResult(
        List<ExpressionRecord> records,
        List<ExpressionRecord> footnoteRecords,
        List<FootnoteRegion> footnoteRegions,
        List<String> integrityWarnings,
        ExtractionStatistics statistics
) {

    private static final ExtractionResult EMPTY = new ExtractionResult(
            List.of(), List.of(), List.of(), List.of(), ExtractionStatistics.EMPTY);

    public ExtractionResult {
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        footnoteRecords = List.copyOf(Objects.requireNonNull(footnoteRecords, "footnoteRecords"));
        footnoteRegions = List.copyOf(Objects.requireNonNull(footnoteRegions, "footnoteRegions"));
        integrityWarnings = List.copyOf(Objects.requireNonNull(integrityWarnings, "integrityWarnings"));
        Objects.requireNonNull(statistics, "statistics");
    }

    public static ExtractionResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return records.isEmpty() && footnoteRecords.isEmpty();
    }

    /**
     * Index-keyed view of the main-flow records.
     */
    public Map<Integer, ExpressionRecord> toIndexMap() {
        Map<Integer, ExpressionRecord> map = new LinkedHashMap<>();
        for (ExpressionRecord r : records) {
            map.put(r.sequenceIndex(), r);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Raw notation of the main-flow records in sequence order.
     */
    public List<String> toPositionSequence() {
        return records.stream().map(ExpressionRecord::rawNotation).toList();
    }
}
