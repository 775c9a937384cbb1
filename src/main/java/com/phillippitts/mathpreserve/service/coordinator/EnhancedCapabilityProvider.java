package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.service.reconstruct.ReconstructionStrategy;

import java.util.Optional;

/**
 * Resolves the optional enhanced strategy. The coordinator asks once per decision and uses the
 * answer for the whole invocation.
 */
@FunctionalInterface
public interface EnhancedCapabilityProvider {

    /**
     * @return the enhanced strategy, or empty when it is not deployed
     */
    Optional<ReconstructionStrategy> resolve();
}
