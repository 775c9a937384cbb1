package com.phillippitts.mathpreserve.service.registry;

import com.phillippitts.mathpreserve.domain.ExpressionRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One immutable generation of registry data. Both views are always installed together.
 *
 * @param byIndex sequence index to record
 * @param byPosition raw notation in index order
 * @param footnoteRecords footnote-scoped records captured in the same pass
 * @param sourceText source the generation was extracted from, empty when not captured
 * @param generation monotonically increasing generation marker
 * @param installedAt install time, null for the empty snapshot
 */
public record RegistrySnapshot(
        Map<Integer, ExpressionRecord> byIndex,
        List<String> byPosition,
        List<ExpressionRecord> footnoteRecords,
        String sourceText,
        long generation,
        Instant installedAt
) {

    static final RegistrySnapshot EMPTY = new RegistrySnapshot(Map.of(), List.of(), List.of(), "", 0L, null);

    public RegistrySnapshot {
        byIndex = Collections.unmodifiableMap(new LinkedHashMap<>(byIndex));
        byPosition = List.copyOf(byPosition);
        footnoteRecords = List.copyOf(footnoteRecords);
        sourceText = sourceText == null ? "" : sourceText;
    }

    public int size() {
        return byIndex.size();
    }

    public boolean isConsistent() {
        return byIndex.size() == byPosition.size();
    }

    public boolean isInstalled() {
        return installedAt != null;
    }
}
