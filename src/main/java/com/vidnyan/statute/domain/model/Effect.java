package com.vidnyan.statute.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Legal effect produced when a statute applies. Opaque payload for the evaluator.
 */
public record Effect(
    EffectKind kind,
    String description
) {

    public Effect {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(description, "description");
    }

    public static Effect grant(String description) {
        return new Effect(EffectKind.GRANT, description);
    }

    public static Effect revoke(String description) {
        return new Effect(EffectKind.REVOKE, description);
    }

    public static Effect obligation(String description) {
        return new Effect(EffectKind.OBLIGATION, description);
    }

    public static Effect prohibition(String description) {
        return new Effect(EffectKind.PROHIBITION, description);
    }

    /**
     * Whether two effects are mutually exclusive by convention:
     * GRANT/PROHIBITION, GRANT/REVOKE or OBLIGATION/PROHIBITION of the same subject.
     */
    public boolean conflictsWith(Effect other) {
        if (!subject().equals(other.subject())) {
            return false;
        }
        return isConflictingPair(kind, other.kind) || isConflictingPair(other.kind, kind);
    }

    /**
     * Description normalized for subject comparison: trimmed, lower-cased, single spaces.
     */
    public String subject() {
        return description.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static boolean isConflictingPair(EffectKind a, EffectKind b) {
        return (a == EffectKind.GRANT && b == EffectKind.PROHIBITION)
                || (a == EffectKind.GRANT && b == EffectKind.REVOKE)
                || (a == EffectKind.OBLIGATION && b == EffectKind.PROHIBITION);
    }

    @Override
    public String toString() {
        return kind + ": " + description;
    }
}
