package com.phillippitts.mathpreserve.domain;

/**
 * Reconstruction strategy that produced a {@link ProcessingResult}.
 */
public enum ProcessingMethod {
    ENHANCED("enhanced"),
    LEGACY("legacy");

    private final String label;

    ProcessingMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
