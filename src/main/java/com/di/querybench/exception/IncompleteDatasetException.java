package com.di.querybench.exception;

import com.di.querybench.load.validation.VerificationResult;

/**
 * The stored dataset does not match the configuration it was supposedly loaded with.
 * Benchmarks refuse to run against it.
 */
public class IncompleteDatasetException extends IllegalStateException {

    private final transient VerificationResult result;

    public IncompleteDatasetException(VerificationResult result) {
        super("Dataset " + result.getVariant().getId() + " is incomplete: " + result.failureSummary());
        this.result = result;
    }

    public VerificationResult getResult() {
        return result;
    }
}
