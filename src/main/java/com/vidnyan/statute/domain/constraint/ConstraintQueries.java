package com.vidnyan.statute.domain.constraint;

import com.vidnyan.statute.domain.model.Condition;

import java.util.Arrays;
import java.util.Optional;

/**
 * Condition-level questions answered through an encoder and a solver.
 * An empty result means the backend could not decide.
 */
public class ConstraintQueries {

    private final ConstraintEncoder encoder;
    private final ConstraintSolver solver;

    public ConstraintQueries(ConstraintEncoder encoder, ConstraintSolver solver) {
        this.encoder = encoder;
        this.solver = solver;
    }

    /**
     * Check a conjunction of conditions; a model in the answer is already decoded.
     */
    public SatResult check(Condition... conjuncts) {
        ConstraintExpr expr = conjuncts.length == 1
                ? encoder.encode(conjuncts[0])
                : ConstraintExpr.and(Arrays.stream(conjuncts).map(encoder::encode).toList());
        return checkEncoded(expr);
    }

    public SatResult checkEncoded(ConstraintExpr expr) {
        SatResult result = solver.checkSat(expr);
        if (result instanceof SatResult.Sat sat) {
            return SatResult.sat(encoder.decode(sat.model()));
        }
        return result;
    }

    public Optional<Boolean> isSatisfiable(Condition condition) {
        return definite(check(condition), true);
    }

    /**
     * {@code a} implies {@code b} when {@code a AND NOT b} has no model.
     */
    public Optional<Boolean> implies(Condition a, Condition b) {
        return definite(check(a, Condition.not(b)), false);
    }

    /**
     * Two conditions contradict when they can never hold together.
     */
    public Optional<Boolean> contradicts(Condition a, Condition b) {
        return definite(check(a, b), false);
    }

    public ConstraintEncoder encoder() {
        return encoder;
    }

    public ConstraintSolver solver() {
        return solver;
    }

    private static Optional<Boolean> definite(SatResult result, boolean whenSat) {
        if (result.isSat()) return Optional.of(whenSat);
        if (result.isUnsat()) return Optional.of(!whenSat);
        return Optional.empty();
    }
}
