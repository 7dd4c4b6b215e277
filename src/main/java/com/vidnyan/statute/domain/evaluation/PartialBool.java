package com.vidnyan.statute.domain.evaluation;

import java.util.Collection;
import java.util.List;

/**
 * Four-valued truth used while evaluating conditions.
 * {@code UNKNOWN} means a fact was missing; {@code CONTRADICTION} means facts disagree.
 */
public enum PartialBool {
    TRUE,
    FALSE,
    UNKNOWN,
    CONTRADICTION;

    public static PartialBool of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Conjunction: FALSE if any operand is FALSE, else CONTRADICTION if any is,
     * else UNKNOWN if any is, else TRUE. Independent of operand order.
     */
    public static PartialBool all(Collection<PartialBool> operands) {
        boolean contradiction = false;
        boolean unknown = false;
        for (PartialBool operand : operands) {
            switch (operand) {
                case FALSE -> {
                    return FALSE;
                }
                case CONTRADICTION -> contradiction = true;
                case UNKNOWN -> unknown = true;
                default -> { }
            }
        }
        if (contradiction) return CONTRADICTION;
        if (unknown) return UNKNOWN;
        return TRUE;
    }

    /**
     * Disjunction, the dual of {@link #all}.
     */
    public static PartialBool any(Collection<PartialBool> operands) {
        boolean contradiction = false;
        boolean unknown = false;
        for (PartialBool operand : operands) {
            switch (operand) {
                case TRUE -> {
                    return TRUE;
                }
                case CONTRADICTION -> contradiction = true;
                case UNKNOWN -> unknown = true;
                default -> { }
            }
        }
        if (contradiction) return CONTRADICTION;
        if (unknown) return UNKNOWN;
        return FALSE;
    }

    public PartialBool and(PartialBool other) {
        return all(List.of(this, other));
    }

    public PartialBool or(PartialBool other) {
        return any(List.of(this, other));
    }

    public PartialBool not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            default -> this;
        };
    }

    public boolean isDefinite() {
        return this == TRUE || this == FALSE;
    }
}
