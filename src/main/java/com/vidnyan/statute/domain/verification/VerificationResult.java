package com.vidnyan.statute.domain.verification;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of verifying a statute set.
 * {@code passed} is true exactly when there are no findings. A cancelled run is
 * {@code complete = false} and carries whatever was found before cancellation.
 */
public record VerificationResult(
    boolean passed,
    List<Finding> findings,
    boolean complete,
    int statutesAnalyzed,
    int solverQueries,
    Duration duration
) {

    public VerificationResult {
        findings = findings.stream().sorted(Finding.ORDER).toList();
        if (passed != findings.isEmpty()) {
            throw new IllegalArgumentException("passed must be true exactly when there are no findings");
        }
    }

    /**
     * Create a result; findings are put in canonical order.
     */
    public static VerificationResult of(List<Finding> findings, boolean complete, int statutesAnalyzed,
                                        int solverQueries, Duration duration) {
        return new VerificationResult(findings.isEmpty(), findings, complete, statutesAnalyzed,
                solverQueries, duration);
    }

    /**
     * Count findings per severity. Every severity is present, possibly with zero.
     */
    public Map<Severity, Integer> findingsBySeverity() {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0);
        }
        findings.forEach(f -> counts.merge(f.severity(), 1, Integer::sum));
        return counts;
    }

    public boolean hasCriticalFindings() {
        return findings.stream().anyMatch(f -> f.severity() == Severity.CRITICAL);
    }

    public List<Finding> findingsOf(FindingCode code) {
        return findings.stream()
                .filter(f -> f.code() == code)
                .toList();
    }

    public int findingCount() {
        return findings.size();
    }
}
