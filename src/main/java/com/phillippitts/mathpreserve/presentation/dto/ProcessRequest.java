package com.phillippitts.mathpreserve.presentation.dto;

import com.phillippitts.mathpreserve.domain.ProcessingOptions;
import jakarta.validation.constraints.NotNull;

/**
 * Rendered markup to reconstruct.
 *
 * @param content rendered markup
 * @param minimumGeneration optional generation the registry must have reached
 */
public record ProcessRequest(@NotNull(message = "content is required") String content, Long minimumGeneration) {

    public ProcessingOptions toOptions() {
        return new ProcessingOptions(content, minimumGeneration);
    }
}
