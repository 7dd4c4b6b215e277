package com.vidnyan.statute.adapter.out.solver;

import com.vidnyan.statute.domain.constraint.ConstraintExpr;
import com.vidnyan.statute.domain.constraint.ConstraintSolver;
import com.vidnyan.statute.domain.constraint.DomainBounds;
import com.vidnyan.statute.domain.constraint.Model;
import com.vidnyan.statute.domain.constraint.SatResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Complete backtracking search for the bounded fragment the encoder produces:
 * integer comparisons over intervals, boolean atoms and string equalities.
 *
 * <p>The formula is first put in negation normal form. Conjunctions narrow the
 * current domains; disjunctions branch. A model that relies on an opaque atom
 * is not trusted, nor is one that solves a single attribute under two variables.
 * If no other model exists the answer is {@code Unknown}.
 * Exceeding the step budget or the timeout also yields {@code Unknown}.
 *
 * <p>Holds no per-query state, so one instance can serve concurrent callers.
 */
@Slf4j
public class BoundedDomainSolver implements ConstraintSolver {

    public static final long DEFAULT_MAX_STEPS = 100_000;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final DomainBounds bounds;
    private final long maxSteps;
    private final Duration timeout;

    public BoundedDomainSolver() {
        this(DomainBounds.defaults(), DEFAULT_MAX_STEPS, DEFAULT_TIMEOUT);
    }

    public BoundedDomainSolver(DomainBounds bounds, long maxSteps, Duration timeout) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive");
        }
        this.bounds = bounds;
        this.maxSteps = maxSteps;
        this.timeout = timeout;
    }

    @Override
    public SatResult checkSat(ConstraintExpr expr) {
        ConstraintExpr nnf = toNnf(expr, false);
        Search search = new Search(System.nanoTime() + timeout.toNanos());
        Deque<ConstraintExpr> pending = new ArrayDeque<>();
        pending.push(nnf);
        try {
            search.explore(pending, new SearchState(bounds));
        } catch (SearchAborted e) {
            log.debug("Solver gave up after {} steps: {}", search.steps, e.getMessage());
            return SatResult.unknown(e.getMessage());
        }
        if (search.model != null) {
            return SatResult.sat(search.model);
        }
        if (search.opaqueWitness) {
            return SatResult.unknown("satisfiable only through atoms outside the supported fragment");
        }
        if (search.sharedFactWitness) {
            return SatResult.unknown("satisfiable only by typing one attribute two ways");
        }
        return SatResult.unsat();
    }

    /**
     * Push negations down to atoms. Negated integer comparisons flip their operator.
     */
    static ConstraintExpr toNnf(ConstraintExpr expr, boolean negated) {
        if (expr instanceof ConstraintExpr.Not not) {
            return toNnf(not.operand(), !negated);
        }
        if (expr instanceof ConstraintExpr.And and) {
            List<ConstraintExpr> operands = and.operands().stream()
                    .map(c -> toNnf(c, negated))
                    .collect(Collectors.toList());
            return negated ? new ConstraintExpr.Or(operands) : new ConstraintExpr.And(operands);
        }
        if (expr instanceof ConstraintExpr.Or or) {
            List<ConstraintExpr> operands = or.operands().stream()
                    .map(c -> toNnf(c, negated))
                    .collect(Collectors.toList());
            return negated ? new ConstraintExpr.And(operands) : new ConstraintExpr.Or(operands);
        }
        if (expr instanceof ConstraintExpr.Const c) {
            return c.value() != negated ? ConstraintExpr.TRUE : ConstraintExpr.FALSE;
        }
        if (expr instanceof ConstraintExpr.IntCompare cmp && negated) {
            return new ConstraintExpr.IntCompare(cmp.variable(), cmp.op().negate(), cmp.value());
        }
        return negated ? new ConstraintExpr.Not(expr) : expr;
    }

    private final class Search {
        private final long deadline;
        private long steps;
        private Model model;
        private boolean opaqueWitness;
        private boolean sharedFactWitness;

        Search(long deadline) {
            this.deadline = deadline;
        }

        /**
         * Returns true once a trusted model has been found.
         */
        boolean explore(Deque<ConstraintExpr> pending, SearchState state) {
            while (!pending.isEmpty()) {
                tick();
                ConstraintExpr expr = pending.pop();
                if (expr instanceof ConstraintExpr.And and) {
                    List<ConstraintExpr> operands = and.operands();
                    for (int i = operands.size() - 1; i >= 0; i--) {
                        pending.push(operands.get(i));
                    }
                } else if (expr instanceof ConstraintExpr.Or or) {
                    for (ConstraintExpr branch : or.operands()) {
                        Deque<ConstraintExpr> next = new ArrayDeque<>(pending);
                        next.push(branch);
                        if (explore(next, state.copy())) {
                            return true;
                        }
                    }
                    return false;
                } else if (!assign(expr, state)) {
                    return false;
                }
            }
            if (state.usesOpaque()) {
                opaqueWitness = true;
                return false;
            }
            if (state.hasSharedFact()) {
                sharedFactWitness = true;
                return false;
            }
            model = state.toModel();
            return true;
        }

        private boolean assign(ConstraintExpr literal, SearchState state) {
            boolean positive = !(literal instanceof ConstraintExpr.Not);
            ConstraintExpr atom = positive ? literal : ((ConstraintExpr.Not) literal).operand();

            if (atom instanceof ConstraintExpr.Const c) {
                return c.value() == positive;
            }
            if (atom instanceof ConstraintExpr.IntCompare cmp) {
                return state.requireInt(cmp.variable(), positive ? cmp.op() : cmp.op().negate(), cmp.value());
            }
            if (atom instanceof ConstraintExpr.BoolAtom b) {
                return state.requireBool(b.variable(), positive);
            }
            if (atom instanceof ConstraintExpr.StringEquals s) {
                return state.requireString(s.variable(), s.value(), positive);
            }
            if (atom instanceof ConstraintExpr.Opaque o) {
                return state.requireOpaque(o.key(), positive);
            }
            throw new IllegalStateException("not in negation normal form: " + literal);
        }

        private void tick() {
            steps++;
            if (steps > maxSteps) {
                throw new SearchAborted("step budget of " + maxSteps + " exhausted");
            }
            if ((steps & 0xFF) == 0 && System.nanoTime() > deadline) {
                throw new SearchAborted("timed out after " + timeout.toMillis() + " ms");
            }
        }
    }

    private static final class SearchAborted extends RuntimeException {
        SearchAborted(String message) {
            super(message, null, false, false);
        }
    }
}
