package com.phillippitts.mathpreserve.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing ReconstructionException with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ReconstructionExceptionBuilder.create("Annotation missing")
 *         .strategy("legacy")
 *         .metadata("node", index)
 *         .build();
 *
 * throw ReconstructionExceptionBuilder.create("Markup could not be parsed")
 *         .strategy("enhanced")
 *         .cause(exception)
 *         .generation(7)
 *         .build();
 * </pre>
 */
public final class ReconstructionExceptionBuilder {

    private final String message;
    private String strategyName;
    private Throwable cause;
    private Long generation;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ReconstructionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ReconstructionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ReconstructionExceptionBuilder(message);
    }

    public ReconstructionExceptionBuilder strategy(String strategyName) {
        this.strategyName = strategyName;
        return this;
    }

    public ReconstructionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the registry generation the strategy was working against.
     */
    public ReconstructionExceptionBuilder generation(long generation) {
        this.generation = generation;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ReconstructionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (generation={n}, {key1}={val1}, ...) (strategy: {strategy})
     * </pre>
     */
    public ReconstructionException build() {
        String detailedMessage = buildDetailedMessage();
        String strategy = strategyName != null ? strategyName : "unknown";
        if (cause != null) {
            return new ReconstructionException(detailedMessage, strategy, cause);
        }
        return new ReconstructionException(detailedMessage, strategy);
    }

    private String buildDetailedMessage() {
        if (generation == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (generation != null) {
            sb.append("generation=").append(generation);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
