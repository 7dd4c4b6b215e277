package com.vidnyan.statute.domain.constraint;

/**
 * Satisfiability backend.
 * Implementations must answer {@link SatResult.Unknown} rather than guess
 * whenever they time out or meet a formula they cannot decide.
 */
public interface ConstraintSolver {

    SatResult checkSat(ConstraintExpr expr);

    /**
     * Whether this backend can ever return a definite answer.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Get the backend name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
