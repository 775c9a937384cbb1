package com.phillippitts.mathpreserve.presentation.dto;

import jakarta.validation.constraints.NotNull;

/** Source text to capture before rendering. */
public record CaptureRequest(@NotNull(message = "source is required") String source) {
}
