package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.constraint.ConstraintEncoder;
import com.vidnyan.statute.domain.constraint.ConstraintQueries;
import com.vidnyan.statute.domain.constraint.ConstraintSolver;
import com.vidnyan.statute.domain.model.Statute;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Static checks over a whole statute set: reference cycles, dead statutes and
 * contradictory pairs, plus the optional advisory passes.
 *
 * <p>The input is never modified. Each call builds its own reference graph and
 * solver session, so concurrent calls share nothing mutable. The result does not
 * depend on the order of the input list.
 */
@Slf4j
public class StatuteVerifier {

    private final ConstraintEncoder encoder;
    private final ConstraintSolver solver;
    private final List<VerificationPass> passes;

    public StatuteVerifier(ConstraintSolver solver) {
        this(new ConstraintEncoder(), solver, defaultPasses());
    }

    public StatuteVerifier(ConstraintEncoder encoder, ConstraintSolver solver, List<VerificationPass> passes) {
        this.encoder = encoder;
        this.solver = solver;
        this.passes = List.copyOf(passes);
    }

    /**
     * Built-in passes in the order they run.
     */
    public static List<VerificationPass> defaultPasses() {
        return List.of(
                new CircularReferencePass(),
                new DeadStatutePass(),
                new ContradictionPass(),
                new RedundantExceptionPass(),
                new UnreachableBranchPass());
    }

    public VerificationResult verify(List<Statute> statutes) {
        return verify(statutes, VerificationOptions.defaults(), CancellationToken.none());
    }

    public VerificationResult verify(List<Statute> statutes, VerificationOptions options) {
        return verify(statutes, options, CancellationToken.none());
    }

    public VerificationResult verify(List<Statute> statutes, VerificationOptions options,
                                     CancellationToken cancellation) {
        Instant start = Instant.now();
        List<Statute> ordered = new ArrayList<>(statutes);
        ordered.sort(Comparator.comparing(Statute::id).thenComparingInt(Statute::version));

        ConstraintSession session = new ConstraintSession(new ConstraintQueries(encoder, solver));
        VerificationScope scope = new VerificationScope(
                ordered, ReferenceGraph.build(ordered), session, options, cancellation);

        log.info("Verifying {} statutes with {}", ordered.size(), solver.getName());
        List<Finding> findings = new ArrayList<>();
        for (VerificationPass pass : passes) {
            if (!pass.isEnabled(options)) {
                continue;
            }
            if (scope.shouldStop()) {
                break;
            }
            List<Finding> found = pass.run(scope);
            log.debug("{} reported {} findings", pass.getName(), found.size());
            findings.addAll(found);
        }

        Duration duration = Duration.between(start, Instant.now());
        boolean complete = !scope.wasInterrupted();
        if (!complete) {
            log.warn("Verification cancelled after {} solver queries", session.queryCount());
        }
        if (session.unknownCount() > 0) {
            log.info("{} of {} solver queries were undecided", session.unknownCount(), session.queryCount());
        }
        VerificationResult result = VerificationResult.of(
                findings, complete, ordered.size(), session.queryCount(), duration);
        log.info("Verification complete: {} findings in {}ms", result.findingCount(), duration.toMillis());
        return result;
    }
}
