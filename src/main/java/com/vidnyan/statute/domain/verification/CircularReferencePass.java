package com.vidnyan.statute.domain.verification;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports supersession and amendment cycles.
 */
@Slf4j
public class CircularReferencePass implements VerificationPass {

    @Override
    public boolean isEnabled(VerificationOptions options) {
        return true;
    }

    @Override
    public List<Finding> run(VerificationScope scope) {
        List<Finding> findings = new ArrayList<>();
        if (scope.shouldStop()) {
            return findings;
        }
        List<List<String>> cycles = scope.graph().findCycles();
        log.debug("Found {} reference cycles", cycles.size());
        for (List<String> cycle : cycles) {
            findings.add(new Finding.CircularReference(cycle));
        }
        return findings;
    }
}
