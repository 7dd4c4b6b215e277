package com.vidnyan.statute.adapter.out.solver;

import com.vidnyan.statute.domain.constraint.ConstraintExpr;
import com.vidnyan.statute.domain.constraint.ConstraintSolver;
import com.vidnyan.statute.domain.constraint.SatResult;

/**
 * Backend used when no solver is configured. Every query is undecided,
 * so solver-backed verification passes report nothing.
 */
public class NoSolverBackend implements ConstraintSolver {

    static final String REASON = "no constraint solver configured";

    @Override
    public SatResult checkSat(ConstraintExpr expr) {
        return SatResult.unknown(REASON);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
