package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.Statute;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory: an exception that can never hold together with the preconditions
 * has no effect. Statutes whose preconditions are themselves unsatisfiable are
 * left to the dead-statute check.
 */
public class RedundantExceptionPass implements VerificationPass {

    @Override
    public boolean isEnabled(VerificationOptions options) {
        return options.detectRedundantExceptions();
    }

    @Override
    public List<Finding> run(VerificationScope scope) {
        List<Finding> findings = new ArrayList<>();
        for (Statute statute : scope.statutes()) {
            if (scope.shouldStop()) {
                break;
            }
            if (statute.exception().isEmpty()) {
                continue;
            }
            Condition exception = statute.exception().get();
            if (scope.session().check(statute.preconditions(), exception).isUnsat()
                    && scope.session().check(statute.preconditions()).isSat()) {
                findings.add(new Finding.RedundantException(statute.id()));
            }
        }
        return findings;
    }
}
