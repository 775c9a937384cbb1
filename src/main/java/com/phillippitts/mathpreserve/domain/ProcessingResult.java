package com.phillippitts.mathpreserve.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Strategy-agnostic reconstruction output.
 *
 * <p>The metadata map always contains {@code method} ({@code "enhanced"} or {@code "legacy"})
 * followed by strategy-specific entries.
 */
public record ProcessingResult(String content, Map<String, Object> metadata) {

    public static final String METHOD_KEY = "method";

    public ProcessingResult {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(metadata, "metadata");
        if (!(metadata.get(METHOD_KEY) instanceof String)) {
            throw new IllegalArgumentException("metadata.method is required");
        }
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ProcessingResult of(String content, ProcessingMethod method, Map<String, Object> details) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(METHOD_KEY, method.label());
        if (details != null) {
            details.forEach((k, v) -> {
                if (!METHOD_KEY.equals(k)) {
                    meta.put(k, v);
                }
            });
        }
        return new ProcessingResult(content, meta);
    }

    public String method() {
        return (String) metadata.get(METHOD_KEY);
    }
}
