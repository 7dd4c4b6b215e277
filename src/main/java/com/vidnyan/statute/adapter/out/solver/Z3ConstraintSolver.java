package com.vidnyan.statute.adapter.out.solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Version;
import com.microsoft.z3.Z3Exception;
import com.vidnyan.statute.domain.constraint.ConstraintEncoder;
import com.vidnyan.statute.domain.constraint.ConstraintExpr;
import com.vidnyan.statute.domain.constraint.ConstraintSolver;
import com.vidnyan.statute.domain.constraint.DomainBounds;
import com.vidnyan.statute.domain.constraint.SatResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Z3-backed solver. Each query runs in its own {@link Context}, so one instance can
 * serve concurrent callers.
 *
 * <p>Unsat answers are always trusted. A model is withheld as {@code Unknown} when
 * the formula has opaque atoms or gives one attribute two variables, since Z3 chose
 * those values without knowing what they mean.
 */
@Slf4j
public class Z3ConstraintSolver implements ConstraintSolver {

    static final String UNAVAILABLE = "z3 native library not available";

    private final DomainBounds bounds;
    private final Duration timeout;

    public Z3ConstraintSolver(DomainBounds bounds, Duration timeout) {
        this.bounds = bounds;
        this.timeout = timeout;
    }

    @Override
    public SatResult checkSat(ConstraintExpr expr) {
        if (!NativeLibrary.LOADED) {
            return SatResult.unknown(UNAVAILABLE);
        }
        try (Context ctx = new Context()) {
            Solver solver = ctx.mkSolver();
            Params params = ctx.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            solver.setParameters(params);

            Z3ExprTranslator translator = new Z3ExprTranslator(ctx, bounds);
            solver.add(translator.translate(expr));
            solver.add(translator.domainConstraints().toArray(new BoolExpr[0]));

            Status status = solver.check();
            log.trace("Z3 answered {} for {}", status, expr);
            return switch (status) {
                case UNSATISFIABLE -> SatResult.unsat();
                case UNKNOWN -> SatResult.unknown("z3: " + solver.getReasonUnknown());
                case SATISFIABLE -> {
                    if (translator.usesOpaque()) {
                        yield SatResult.unknown("satisfiable only through atoms outside the supported fragment");
                    }
                    if (ConstraintEncoder.sharesFact(translator.variables())) {
                        yield SatResult.unknown("satisfiable only by typing one attribute two ways");
                    }
                    yield SatResult.sat(translator.readModel(solver.getModel()));
                }
            };
        } catch (Z3Exception e) {
            log.warn("Z3 failed on {}: {}", expr, e.getMessage());
            return SatResult.unknown("z3 error: " + e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return NativeLibrary.LOADED;
    }

    private static final class NativeLibrary {
        static final boolean LOADED = load();

        private static boolean load() {
            try (Context ignored = new Context()) {
                log.info("Loaded Z3 {}", Version.getFullVersion());
                return true;
            } catch (LinkageError e) {
                log.warn("Z3 native library could not be loaded, queries will be undecided: {}", e.getMessage());
                return false;
            }
        }
    }
}
