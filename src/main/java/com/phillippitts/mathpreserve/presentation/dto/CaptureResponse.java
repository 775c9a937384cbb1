package com.phillippitts.mathpreserve.presentation.dto;

import com.phillippitts.mathpreserve.domain.ExtractionStatistics;
import com.phillippitts.mathpreserve.service.capture.CaptureSummary;

import java.util.List;

/** Outcome of a capture, without the captured notation itself. */
public record CaptureResponse(
        long generation,
        boolean installed,
        int expressionCount,
        int footnoteCount,
        int footnoteRegionCount,
        List<String> warnings,
        ExtractionStatistics statistics
) {

    public static CaptureResponse from(CaptureSummary summary) {
        return new CaptureResponse(
                summary.generation(),
                summary.installed(),
                summary.extraction().records().size(),
                summary.extraction().footnoteRecords().size(),
                summary.extraction().footnoteRegions().size(),
                summary.extraction().integrityWarnings(),
                summary.extraction().statistics());
    }
}
