package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExpressionRecord;
import com.phillippitts.mathpreserve.domain.ExtractionResult;
import com.phillippitts.mathpreserve.domain.ExtractionStatistics;
import com.phillippitts.mathpreserve.domain.FootnoteRegion;
import com.phillippitts.mathpreserve.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Two-phase extractor: every family scans independently, then candidates are merged into
 * document order.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Compute footnote regions with {@link FootnoteRegionScanner}</li>
 *   <li>Collect matches from each {@link NotationPattern} with absolute offsets</li>
 *   <li>Discard candidates nested inside another candidate's span</li>
 *   <li>Partition into main-flow and footnote-scoped by region membership</li>
 *   <li>Stable-sort main-flow candidates by offset and number them 0..n-1</li>
 *   <li>Report duplicate offsets as integrity warnings, keeping arrival order</li>
 * </ol>
 *
 * <p>A family that throws is logged and skipped; extraction never aborts.
 *
 * <p><b>Thread Safety:</b> stateless after construction.
 */
public final class DefaultExpressionExtractor implements ExpressionExtractor {

    private static final Logger LOG = LogManager.getLogger(DefaultExpressionExtractor.class);

    private final List<NotationPattern> families;
    private final FootnoteRegionScanner footnoteScanner;
    private final int previewChars;

    /**
     * @param families pattern families in arrival order (used as tiebreak on equal offsets)
     * @param footnoteScanner footnote region scanner
     * @param previewChars characters of notation echoed into logs
     */
    public DefaultExpressionExtractor(List<NotationPattern> families,
                                      FootnoteRegionScanner footnoteScanner,
                                      int previewChars) {
        Objects.requireNonNull(families, "families");
        if (families.isEmpty()) {
            throw new IllegalArgumentException("At least one pattern family is required");
        }
        this.families = List.copyOf(families);
        this.footnoteScanner = Objects.requireNonNull(footnoteScanner, "footnoteScanner");
        this.previewChars = previewChars;
    }

    /**
     * Standard families in their canonical arrival order.
     */
    public static List<NotationPattern> standardFamilies(List<String> environmentNames) {
        return List.of(
                new EnvironmentPattern(environmentNames),
                new DoubleDollarPattern(),
                new BracketDisplayPattern(),
                new SingleDollarPattern(),
                new ParenInlinePattern());
    }

    @Override
    public ExtractionResult extract(String source) {
        if (source == null || source.isBlank()) {
            return ExtractionResult.empty();
        }

        List<String> warnings = new ArrayList<>();
        List<FootnoteRegion> regions = footnoteScanner.scan(source, warnings);
        List<NotationMatch> candidates = removeNested(collect(source, warnings));

        List<NotationMatch> main = new ArrayList<>();
        List<NotationMatch> footnotes = new ArrayList<>();
        for (NotationMatch candidate : candidates) {
            if (isInsideAny(candidate.start(), regions)) {
                footnotes.add(candidate);
            } else {
                main.add(candidate);
            }
        }

        // List.sort is stable, so equal offsets keep arrival order
        main.sort(Comparator.comparingInt(NotationMatch::start));
        footnotes.sort(Comparator.comparingInt(NotationMatch::start));

        List<ExpressionRecord> records = new ArrayList<>(main.size());
        for (int i = 0; i < main.size(); i++) {
            records.add(main.get(i).toRecord().withSequenceIndex(i));
        }
        List<ExpressionRecord> footnoteRecords = footnotes.stream()
                .map(m -> m.toRecord().asFootnoteScoped())
                .toList();

        reportDuplicateOffsets(main, warnings);

        List<ExpressionRecord> all = new ArrayList<>(records);
        all.addAll(footnoteRecords);
        ExtractionStatistics stats = ExtractionStatistics.of(all);

        LOG.debug("Extracted {} main-flow and {} footnote expressions ({} regions, {} warnings)",
                records.size(), footnoteRecords.size(), regions.size(), warnings.size());
        return new ExtractionResult(records, footnoteRecords, regions, warnings, stats);
    }

    private List<NotationMatch> collect(String source, List<String> warnings) {
        List<NotationMatch> all = new ArrayList<>();
        for (NotationPattern family : families) {
            try {
                List<NotationMatch> found = family.scan(source);
                LOG.trace("Family {} matched {} candidates", family.name(), found.size());
                all.addAll(found);
            } catch (RuntimeException e) {
                String warning = "Pattern family " + family.name() + " failed: " + e.getClass().getSimpleName();
                LOG.warn(warning, e);
                warnings.add(warning);
            }
        }
        return all;
    }

    /**
     * Drops candidates lying strictly inside another candidate's span. Arrival order of the
     * survivors is preserved.
     */
    static List<NotationMatch> removeNested(List<NotationMatch> candidates) {
        List<NotationMatch> kept = new ArrayList<>(candidates.size());
        for (NotationMatch candidate : candidates) {
            boolean nested = false;
            for (NotationMatch other : candidates) {
                if (other != candidate && candidate.isNestedIn(other)) {
                    nested = true;
                    break;
                }
            }
            if (!nested) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private static boolean isInsideAny(int offset, List<FootnoteRegion> regions) {
        for (FootnoteRegion region : regions) {
            if (region.contains(offset)) {
                return true;
            }
        }
        return false;
    }

    private void reportDuplicateOffsets(List<NotationMatch> ordered, List<String> warnings) {
        Map<Integer, NotationMatch> seen = new HashMap<>();
        for (NotationMatch match : ordered) {
            NotationMatch first = seen.putIfAbsent(match.start(), match);
            if (first != null) {
                String warning = "Duplicate source offset " + match.start() + " from families "
                        + first.family() + " and " + match.family() + "; keeping arrival order";
                LOG.warn("{} (notation='{}')", warning, LogSanitizer.preview(match.rawNotation(), previewChars));
                warnings.add(warning);
            }
        }
    }
}
