package com.vidnyan.statute.domain.verification;

/**
 * Switches for the advisory passes. Cycle, dead-statute and contradiction checks always run.
 */
public record VerificationOptions(
    boolean detectRedundantExceptions,
    boolean detectUnreachableBranches
) {

    public static VerificationOptions defaults() {
        return new VerificationOptions(false, false);
    }

    public static VerificationOptions withAdvisories() {
        return new VerificationOptions(true, true);
    }
}
