package com.armada.core.capability;

/**
 * Post-merge verification (builds, linters, tests) run before a mission completes.
 */
@FunctionalInterface
public interface VerificationCapability {

    /** Accepts everything. Used when no verification pipeline is configured. */
    VerificationCapability ACCEPT_ALL = request ->
            VerificationResult.passed("No verification configured");

    VerificationResult verify(VerificationRequest request);
}
