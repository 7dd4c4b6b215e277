package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.constraint.SatResult;
import com.vidnyan.statute.domain.model.Statute;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports pairs of statutes with conflicting effects that can apply to the same entity
 * at the same time. Pairs whose effects agree or whose validity windows are disjoint
 * are skipped without a solver query.
 */
@Slf4j
public class ContradictionPass implements VerificationPass {

    @Override
    public boolean isEnabled(VerificationOptions options) {
        return true;
    }

    @Override
    public List<Finding> run(VerificationScope scope) {
        List<Finding> findings = new ArrayList<>();
        List<Statute> statutes = scope.statutes();
        for (int i = 0; i < statutes.size(); i++) {
            for (int j = i + 1; j < statutes.size(); j++) {
                if (scope.shouldStop()) {
                    return findings;
                }
                Statute a = statutes.get(i);
                Statute b = statutes.get(j);
                if (!a.primaryEffect().conflictsWith(b.primaryEffect())
                        || !a.temporalValidity().overlaps(b.temporalValidity())) {
                    continue;
                }
                SatResult result = scope.session().check(a.preconditions(), b.preconditions());
                if (result instanceof SatResult.Sat sat) {
                    log.debug("Statutes {} and {} conflict, witness {}", a.id(), b.id(), sat.model());
                    findings.add(new Finding.Contradiction(a.id(), b.id(), Optional.of(sat.model())));
                }
            }
        }
        return findings;
    }
}
