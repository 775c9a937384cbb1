package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.FootnoteRegion;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates footnote bodies by depth-balanced scanning.
 *
 * <p>Recognised introducers are {@code \footnote{}, {@code \footnotetext{} (closed by the matching
 * brace) and the inline note {@code ^[} (closed by the matching bracket). Nested groups of the
 * same kind raise the depth; a backslash escapes the following character so {@code \}} and
 * {@code \]} never close a region. A region that never closes is dropped with a warning and
 * scanning resumes right after its introducer, so later offsets are unaffected.
 */
public final class FootnoteRegionScanner {

    private static final Logger LOG = LogManager.getLogger(FootnoteRegionScanner.class);

    private static final List<Introducer> INTRODUCERS = List.of(
            new Introducer("\\footnotetext{", '{', '}'),
            new Introducer("\\footnote{", '{', '}'),
            new Introducer("^[", '[', ']'));

    /**
     * Scans the source for footnote regions.
     *
     * @param source text to scan (null yields no regions)
     * @param warnings sink for malformed-region warnings
     * @return regions in ascending start order, never overlapping
     */
    public List<FootnoteRegion> scan(String source, List<String> warnings) {
        List<FootnoteRegion> regions = new ArrayList<>();
        if (source == null || source.isEmpty()) {
            return regions;
        }
        int i = 0;
        int length = source.length();
        while (i < length) {
            Introducer intro = introducerAt(source, i);
            if (intro == null) {
                i++;
                continue;
            }
            int openerIndex = i + intro.token().length() - 1;
            int closerIndex = findCloser(source, openerIndex + 1, intro.open(), intro.close());
            if (closerIndex < 0) {
                String warning = "Unterminated footnote region at offset " + i + " (" + intro.token() + ")";
                LOG.warn(warning);
                warnings.add(warning);
                i = openerIndex + 1;
                continue;
            }
            regions.add(new FootnoteRegion(i, closerIndex + 1));
            i = closerIndex + 1;
        }
        return regions;
    }

    private static Introducer introducerAt(String source, int index) {
        if (index > 0 && source.charAt(index - 1) == '\\') {
            return null;
        }
        for (Introducer intro : INTRODUCERS) {
            if (source.startsWith(intro.token(), index)) {
                return intro;
            }
        }
        return null;
    }

    private static int findCloser(String source, int from, char open, char close) {
        int depth = 1;
        int j = from;
        while (j < source.length()) {
            char c = source.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return j;
                }
            }
            j++;
        }
        return -1;
    }

    private record Introducer(String token, char open, char close) {
    }
}
