package com.vidnyan.statute.domain.verification;

/**
 * Finding severity, in increasing order.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
