package com.phillippitts.mathpreserve.exception;

/**
 * Base exception for all math-preserve application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MathPreserveException extends RuntimeException {

    public MathPreserveException(String message) {
        super(message);
    }

    public MathPreserveException(String message, Throwable cause) {
        super(message, cause);
    }

    public MathPreserveException(Throwable cause) {
        super(cause);
    }
}
