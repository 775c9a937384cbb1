package com.phillippitts.mathpreserve.service.reconstruct;

import com.phillippitts.mathpreserve.domain.ProcessingMethod;
import com.phillippitts.mathpreserve.domain.ProcessingOptions;
import com.phillippitts.mathpreserve.domain.ProcessingResult;

import java.util.Optional;

/**
 * Turns rendered markup back into source notation.
 *
 * <p>An empty result means the strategy's inputs became unavailable between the availability
 * check and execution. It is a routine signal to fall back, distinct from a thrown exception.
 */
public interface ReconstructionStrategy {

    ProcessingMethod method();

    /**
     * Reconstructs the rendered content.
     *
     * @param options rendered content and generation expectations
     * @return result, or empty when the strategy cannot run right now
     * @throws com.phillippitts.mathpreserve.exception.ReconstructionException on execution failure
     */
    Optional<ProcessingResult> reconstruct(ProcessingOptions options);
}
