package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.service.registry.RegistryStatus;

/**
 * Strategy availability at one decision point.
 *
 * @param legacyPresent legacy strategy deployed
 * @param enhancedPresent enhanced strategy deployed
 * @param enhancedReady enhanced strategy exposes the registry-backed entry point
 * @param registryReady registry initialised, consistent, fresh and recent enough for the caller
 * @param registry registry status the decision was based on
 */
public record AvailabilityReport(
        boolean legacyPresent,
        boolean enhancedPresent,
        boolean enhancedReady,
        boolean registryReady,
        RegistryStatus registry
) {

    public boolean enhancedAvailable() {
        return enhancedPresent && enhancedReady && registryReady;
    }
}
