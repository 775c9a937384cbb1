package com.phillippitts.mathpreserve.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Operator override for strategy selection.
 */
public enum ProcessingMode {
    /** Enhanced when available, Legacy otherwise. */
    AUTO,
    /** Enhanced preferred; downgrades to Legacy with a warning when unavailable. */
    ENHANCED,
    /** Legacy unconditionally. */
    LEGACY;

    /**
     * Parses a mode name case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no mode
     */
    public static ProcessingMode parse(String value) {
        if (value != null) {
            for (ProcessingMode mode : values()) {
                if (mode.name().equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        String allowed = Arrays.stream(values())
                .map(m -> m.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Invalid processing mode: " + value + ". Must be one of: " + allowed);
    }
}
