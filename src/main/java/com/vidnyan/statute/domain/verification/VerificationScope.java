package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.model.Statute;

import java.util.List;

/**
 * Everything a pass may read during one verification run.
 * Statutes are sorted by id so passes visit them in a fixed order.
 */
public final class VerificationScope {

    private final List<Statute> statutes;
    private final ReferenceGraph graph;
    private final ConstraintSession session;
    private final VerificationOptions options;
    private final CancellationToken cancellation;
    private boolean interrupted;

    VerificationScope(List<Statute> statutes, ReferenceGraph graph, ConstraintSession session,
                      VerificationOptions options, CancellationToken cancellation) {
        this.statutes = List.copyOf(statutes);
        this.graph = graph;
        this.session = session;
        this.options = options;
        this.cancellation = cancellation;
    }

    public List<Statute> statutes() {
        return statutes;
    }

    public ReferenceGraph graph() {
        return graph;
    }

    ConstraintSession session() {
        return session;
    }

    public VerificationOptions options() {
        return options;
    }

    /**
     * Poll the cancellation token. Once it reports true the run is marked incomplete.
     */
    public boolean shouldStop() {
        if (cancellation.isCancelled()) {
            interrupted = true;
        }
        return interrupted;
    }

    boolean wasInterrupted() {
        return interrupted;
    }
}
