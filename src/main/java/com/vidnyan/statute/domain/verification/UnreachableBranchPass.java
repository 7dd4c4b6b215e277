package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.dsl.StatutePrinter;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.Statute;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory: an OR branch that cannot hold together with the conditions AND-ed around it.
 * Descent stops at NOT, where reachability would invert.
 */
public class UnreachableBranchPass implements VerificationPass {

    @Override
    public boolean isEnabled(VerificationOptions options) {
        return options.detectUnreachableBranches();
    }

    @Override
    public List<Finding> run(VerificationScope scope) {
        List<Finding> findings = new ArrayList<>();
        for (Statute statute : scope.statutes()) {
            if (scope.shouldStop()) {
                break;
            }
            // dead statutes are reported by their own check
            if (scope.session().check(statute.preconditions()).isSat()) {
                inspect(statute, statute.preconditions(), List.of(), scope, findings);
            }
        }
        return findings;
    }

    private void inspect(Statute statute, Condition node, List<Condition> context,
                         VerificationScope scope, List<Finding> findings) {
        if (node instanceof Condition.And and) {
            List<Condition> operands = and.operands();
            for (int i = 0; i < operands.size(); i++) {
                List<Condition> siblings = new ArrayList<>(context);
                for (int j = 0; j < operands.size(); j++) {
                    if (j != i) {
                        siblings.add(operands.get(j));
                    }
                }
                inspect(statute, operands.get(i), siblings, scope, findings);
            }
        } else if (node instanceof Condition.Or or) {
            for (Condition branch : or.operands()) {
                List<Condition> query = new ArrayList<>(context);
                query.add(branch);
                if (scope.session().check(query.toArray(new Condition[0])).isUnsat()) {
                    findings.add(new Finding.UnreachableBranch(statute.id(), StatutePrinter.printCondition(branch)));
                } else {
                    inspect(statute, branch, context, scope, findings);
                }
            }
        }
    }
}
