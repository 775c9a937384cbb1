package com.phillippitts.mathpreserve.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/** New processing mode name: auto, enhanced or legacy. */
public record ModeRequest(@NotBlank(message = "mode is required") String mode) {
}
