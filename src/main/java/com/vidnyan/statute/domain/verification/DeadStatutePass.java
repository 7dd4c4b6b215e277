package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.constraint.SatResult;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.Statute;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports statutes whose {@code preconditions AND NOT exception} has no model.
 * An undecided query reports nothing.
 */
@Slf4j
public class DeadStatutePass implements VerificationPass {

    @Override
    public boolean isEnabled(VerificationOptions options) {
        return true;
    }

    @Override
    public List<Finding> run(VerificationScope scope) {
        List<Finding> findings = new ArrayList<>();
        for (Statute statute : scope.statutes()) {
            if (scope.shouldStop()) {
                break;
            }
            SatResult result = statute.exception()
                    .map(e -> scope.session().check(statute.preconditions(), Condition.not(e)))
                    .orElseGet(() -> scope.session().check(statute.preconditions()));
            if (result.isUnsat()) {
                log.debug("Statute {} is dead", statute.id());
                findings.add(new Finding.DeadStatute(statute.id()));
            }
        }
        return findings;
    }
}
