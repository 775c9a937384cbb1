package com.phillippitts.mathpreserve.exception;

/**
 * Thrown when no reconstruction strategy produced a result.
 *
 * <p>The message is deliberately generic; the failed combination is available only through the
 * cause chain and the logs.
 */
public class ReconstructionFailedException extends MathPreserveException {

    public static final String MESSAGE = "Both enhanced and legacy processing failed";

    public ReconstructionFailedException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
