package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.domain.ProcessingMethod;
import com.phillippitts.mathpreserve.domain.ProcessingMode;

import java.util.List;

/**
 * Operator view of the coordinator: mode, availability, the strategy the next call would use and
 * suggested actions.
 */
public record CoordinatorDiagnostics(
        ProcessingMode mode,
        AvailabilityReport availability,
        ProcessingMethod selectedMethod,
        List<String> recommendations
) {

    public CoordinatorDiagnostics {
        recommendations = List.copyOf(recommendations);
    }
}
