package com.vidnyan.statute.domain.verification;

import java.util.List;

/**
 * One independent, read-only check over a statute set.
 */
public interface VerificationPass {

    /**
     * Check if this pass should run under the given options.
     */
    boolean isEnabled(VerificationOptions options);

    /**
     * Run the check. Implementations poll {@link VerificationScope#shouldStop()}
     * between units of work and return what they found so far when it is true.
     */
    List<Finding> run(VerificationScope scope);

    /**
     * Get the pass name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
