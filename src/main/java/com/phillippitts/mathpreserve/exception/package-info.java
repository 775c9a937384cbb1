/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mathpreserve.exception.MathPreserveException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.mathpreserve.exception.ReconstructionException} - One strategy
 *       failed; absorbed by the coordinator and turned into a fallback</li>
 *   <li>{@link com.phillippitts.mathpreserve.exception.ReconstructionFailedException} - No
 *       strategy produced a result; the only reconstruction error callers see</li>
 * </ul>
 *
 * <p>Extraction never throws for bad input and cleanup deferral is a normal result, so neither
 * has an exception type here.
 *
 * @see com.phillippitts.mathpreserve.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.mathpreserve.exception;
