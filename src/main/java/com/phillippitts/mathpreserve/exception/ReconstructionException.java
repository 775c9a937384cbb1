package com.phillippitts.mathpreserve.exception;

/**
 * Thrown when a single reconstruction strategy fails.
 *
 * <p>The coordinator absorbs these and falls back to the next strategy; they reach the caller
 * only wrapped in a {@link ReconstructionFailedException}.
 */
public class ReconstructionException extends MathPreserveException {

    private final String strategyName;

    public ReconstructionException(String message) {
        super(message);
        this.strategyName = "unknown";
    }

    public ReconstructionException(String message, String strategyName) {
        super(message + " (strategy: " + strategyName + ")");
        this.strategyName = strategyName;
    }

    public ReconstructionException(String message, String strategyName, Throwable cause) {
        super(message + " (strategy: " + strategyName + ")", cause);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
