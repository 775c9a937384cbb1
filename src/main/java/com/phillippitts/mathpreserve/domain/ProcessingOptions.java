package com.phillippitts.mathpreserve.domain;

/**
 * Input to a reconstruction.
 *
 * @param content rendered document markup
 * @param minimumGeneration registry generation the caller expects at least, or {@code null} when any
 *                          fresh generation is acceptable
 */
public record ProcessingOptions(String content, Long minimumGeneration) {

    public ProcessingOptions {
        if (content == null) {
            throw new IllegalArgumentException("content must not be null");
        }
    }

    public static ProcessingOptions of(String content) {
        return new ProcessingOptions(content, null);
    }
}
