package com.vidnyan.statute.domain.verification;

/**
 * Machine-checkable reason code of a finding, with its default severity.
 */
public enum FindingCode {
    CIRCULAR_REFERENCE("SV001", Severity.CRITICAL),
    DEAD_STATUTE("SV002", Severity.ERROR),
    CONTRADICTION("SV003", Severity.ERROR),
    REDUNDANT_EXCEPTION("SV101", Severity.WARNING),
    UNREACHABLE_BRANCH("SV102", Severity.INFO);

    private final String id;
    private final Severity severity;

    FindingCode(String id, Severity severity) {
        this.id = id;
        this.severity = severity;
    }

    /**
     * Stable identifier for reports, e.g. {@code SV001}.
     */
    public String id() {
        return id;
    }

    public Severity severity() {
        return severity;
    }
}
