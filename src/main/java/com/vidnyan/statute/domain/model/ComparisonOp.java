package com.vidnyan.statute.domain.model;

import java.util.Optional;

/**
 * Comparison operators used by numeric and date predicates.
 */
public enum ComparisonOp {
    EQUAL("="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Canonical DSL spelling.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Apply the operator to {@code left OP right}.
     */
    public <T extends Comparable<? super T>> boolean test(T left, T right) {
        int cmp = left.compareTo(right);
        return switch (this) {
            case EQUAL -> cmp == 0;
            case NOT_EQUAL -> cmp != 0;
            case LESS_THAN -> cmp < 0;
            case LESS_OR_EQUAL -> cmp <= 0;
            case GREATER_THAN -> cmp > 0;
            case GREATER_OR_EQUAL -> cmp >= 0;
        };
    }

    /**
     * The operator satisfied exactly when this one is not.
     */
    public ComparisonOp negate() {
        return switch (this) {
            case EQUAL -> NOT_EQUAL;
            case NOT_EQUAL -> EQUAL;
            case LESS_THAN -> GREATER_OR_EQUAL;
            case LESS_OR_EQUAL -> GREATER_THAN;
            case GREATER_THAN -> LESS_OR_EQUAL;
            case GREATER_OR_EQUAL -> LESS_THAN;
        };
    }

    /**
     * Resolve an operator from its source spelling, including the accepted aliases.
     */
    public static Optional<ComparisonOp> fromSymbol(String text) {
        return switch (text) {
            case "=", "==" -> Optional.of(EQUAL);
            case "!=", "<>", "≠" -> Optional.of(NOT_EQUAL);
            case "<" -> Optional.of(LESS_THAN);
            case "<=", "≤" -> Optional.of(LESS_OR_EQUAL);
            case ">" -> Optional.of(GREATER_THAN);
            case ">=", "≥" -> Optional.of(GREATER_OR_EQUAL);
            default -> Optional.empty();
        };
    }
}
