package com.phillippitts.mathpreserve.service.extraction;

import com.phillippitts.mathpreserve.domain.ExtractionResult;

/**
 * Captures notation from source text before it is handed to the renderer.
 *
 * <p>Implementations are pure: the same input always yields the same result and nothing outside
 * the returned value changes. Malformed or empty input yields an empty result, never an exception.
 */
@FunctionalInterface
public interface ExpressionExtractor {

    /**
     * Extracts ordered records and footnote regions from the source.
     *
     * @param source source text, may be null
     * @return extraction result, never null
     */
    ExtractionResult extract(String source);
}
