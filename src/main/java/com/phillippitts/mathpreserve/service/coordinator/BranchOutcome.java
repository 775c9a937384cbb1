package com.phillippitts.mathpreserve.service.coordinator;

import com.phillippitts.mathpreserve.domain.ProcessingResult;

/**
 * One branch of a comparison run: a result or the error that replaced it.
 */
public record BranchOutcome(boolean success, ProcessingResult result, String error) {

    public static BranchOutcome success(ProcessingResult result) {
        return new BranchOutcome(true, result, null);
    }

    public static BranchOutcome failure(String error) {
        return new BranchOutcome(false, null, error);
    }
}
