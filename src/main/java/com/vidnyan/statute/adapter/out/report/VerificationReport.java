package com.vidnyan.statute.adapter.out.report;

import com.vidnyan.statute.domain.verification.Finding;
import com.vidnyan.statute.domain.verification.Severity;
import com.vidnyan.statute.domain.verification.VerificationResult;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Report model - serialisable view of a verification result.
 * Findings keep the canonical order of the result.
 */
@Value
@Builder
public class VerificationReport {
    Summary summary;
    List<FindingEntry> findings;

    @Value
    @Builder
    public static class Summary {
        boolean passed;
        boolean complete;
        int statutesAnalyzed;
        int solverQueries;
        long durationMillis;
        int totalFindings;
        Map<Severity, Integer> findingsBySeverity;
    }

    @Value
    @Builder
    public static class FindingEntry {
        String code;
        String kind;
        Severity severity;
        List<String> statuteIds;
        String message;
        Map<String, String> witness;
    }

    /**
     * Build report from a verification result.
     */
    public static VerificationReport build(VerificationResult result) {
        Summary summary = Summary.builder()
                .passed(result.passed())
                .complete(result.complete())
                .statutesAnalyzed(result.statutesAnalyzed())
                .solverQueries(result.solverQueries())
                .durationMillis(result.duration().toMillis())
                .totalFindings(result.findingCount())
                .findingsBySeverity(result.findingsBySeverity())
                .build();

        List<FindingEntry> entries = result.findings().stream()
                .map(VerificationReport::entry)
                .toList();

        return VerificationReport.builder()
                .summary(summary)
                .findings(entries)
                .build();
    }

    private static FindingEntry entry(Finding finding) {
        Map<String, String> witness = null;
        if (finding instanceof Finding.Contradiction c && c.witness().isPresent()) {
            witness = new LinkedHashMap<>();
            Map<String, String> values = witness;
            c.witness().get().assignments().forEach((name, value) -> values.put(name, value.toString()));
        }
        return FindingEntry.builder()
                .code(finding.code().id())
                .kind(finding.code().name())
                .severity(finding.severity())
                .statuteIds(finding.statuteIds())
                .message(finding.message())
                .witness(witness)
                .build();
    }
}
