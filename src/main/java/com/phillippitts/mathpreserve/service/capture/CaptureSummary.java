package com.phillippitts.mathpreserve.service.capture;

import com.phillippitts.mathpreserve.domain.ExtractionResult;

/**
 * Result of a capture pass.
 *
 * @param generation generation ticket used for the install
 * @param installed whether the registry accepted the generation
 * @param extraction the extraction output
 */
public record CaptureSummary(long generation, boolean installed, ExtractionResult extraction) {
}
