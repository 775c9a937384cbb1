package com.phillippitts.mathpreserve.service.extraction;

import java.util.List;

/**
 * One independently scanned notation family.
 *
 * <p>Implementations scan the whole source and report matches with absolute offsets in the
 * order they are found. They never see each other's results; ordering across families is the
 * extractor's job.
 */
public interface NotationPattern {

    /**
     * Stable family name used in logs and diagnostics.
     */
    String name();

    /**
     * Scans the complete source text.
     *
     * @param source non-null source text
     * @return matches in scan order, never null
     */
    List<NotationMatch> scan(String source);
}
