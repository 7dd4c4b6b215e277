package com.vidnyan.statute.domain.model;

/**
 * Structural problem found by {@link Statute#validate()}.
 */
public record StatuteValidationError(
    Code code,
    String message
) {

    public enum Code {
        EMPTY_ID,
        INVALID_ID,
        EMPTY_TITLE,
        EMPTY_EFFECT_DESCRIPTION,
        INVALID_VERSION,
        UNREALISTIC_AGE
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
