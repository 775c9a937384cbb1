package com.phillippitts.mathpreserve.presentation.dto;

import com.phillippitts.mathpreserve.service.cleanup.CleanupReport;

/**
 * Cleanup outcome plus the cleaned markup (unchanged when the pass was deferred).
 */
public record CleanupResponse(CleanupReport report, String content) {
}
