package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.constraint.ConstraintQueries;
import com.vidnyan.statute.domain.constraint.SatResult;
import com.vidnyan.statute.domain.model.Condition;
import lombok.extern.slf4j.Slf4j;

/**
 * Solver access for one verification run. Counts the queries it issues.
 * Not shared between runs.
 */
@Slf4j
final class ConstraintSession {

    private final ConstraintQueries queries;
    private int queryCount;
    private int unknownCount;

    ConstraintSession(ConstraintQueries queries) {
        this.queries = queries;
    }

    /**
     * Check whether all given conditions can hold at once.
     */
    SatResult check(Condition... conjuncts) {
        queryCount++;
        SatResult result = queries.check(conjuncts);
        if (result instanceof SatResult.Unknown unknown) {
            unknownCount++;
            log.debug("Solver could not decide query {}: {}", queryCount, unknown.reason());
        }
        return result;
    }

    int queryCount() {
        return queryCount;
    }

    int unknownCount() {
        return unknownCount;
    }
}
