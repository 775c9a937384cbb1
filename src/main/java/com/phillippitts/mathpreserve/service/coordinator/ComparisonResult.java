package com.phillippitts.mathpreserve.service.coordinator;

import java.time.Instant;

/**
 * Side-by-side run of both strategies for equivalence checking.
 *
 * @param legacy legacy branch
 * @param enhanced enhanced branch
 * @param metadata availability at the time of the run
 */
public record ComparisonResult(BranchOutcome legacy, BranchOutcome enhanced, Metadata metadata) {

    /**
     * @param timestamp when the comparison ran
     * @param enhancedAvailable whether ordinary selection would have chosen enhanced
     * @param registryReady whether the registry was usable
     * @param contentMatches both branches succeeded with identical content
     */
    public record Metadata(Instant timestamp, boolean enhancedAvailable, boolean registryReady,
                           boolean contentMatches) {
    }
}
