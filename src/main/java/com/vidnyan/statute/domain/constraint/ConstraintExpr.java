package com.vidnyan.statute.domain.constraint;

import com.vidnyan.statute.domain.model.ComparisonOp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Solver-neutral quantifier-free formula over sorted variables.
 */
public sealed interface ConstraintExpr {

    ConstraintExpr TRUE = new Const(true);
    ConstraintExpr FALSE = new Const(false);

    record Const(boolean value) implements ConstraintExpr {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * {@code var OP value} over an integer variable.
     */
    record IntCompare(Variable variable, ComparisonOp op, long value) implements ConstraintExpr {
        public IntCompare {
            requireSort(variable, VariableSort.INT);
            Objects.requireNonNull(op, "op");
        }

        @Override
        public String toString() {
            return variable.name() + " " + op.symbol() + " " + value;
        }
    }

    /**
     * Boolean variable used as an atom.
     */
    record BoolAtom(Variable variable) implements ConstraintExpr {
        public BoolAtom {
            requireSort(variable, VariableSort.BOOL);
        }

        @Override
        public String toString() {
            return variable.name();
        }
    }

    record StringEquals(Variable variable, String value) implements ConstraintExpr {
        public StringEquals {
            requireSort(variable, VariableSort.STRING);
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return variable.name() + " = \"" + value + "\"";
        }
    }

    /**
     * Atom outside the decidable fragment. The backend may branch on it
     * but cannot vouch for a model that depends on it.
     */
    record Opaque(String key) implements ConstraintExpr {
        public Opaque {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String toString() {
            return "<" + key + ">";
        }
    }

    record And(List<ConstraintExpr> operands) implements ConstraintExpr {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" & ", "(", ")"));
        }
    }

    record Or(List<ConstraintExpr> operands) implements ConstraintExpr {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(" | ", "(", ")"));
        }
    }

    record Not(ConstraintExpr operand) implements ConstraintExpr {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public String toString() {
            return "!" + operand;
        }
    }

    static ConstraintExpr and(ConstraintExpr... operands) {
        return and(Arrays.asList(operands));
    }

    /**
     * Conjunction; an empty list is {@link #TRUE}, a single operand is returned as is.
     */
    static ConstraintExpr and(List<ConstraintExpr> operands) {
        if (operands.isEmpty()) return TRUE;
        if (operands.size() == 1) return operands.get(0);
        return new And(new ArrayList<>(operands));
    }

    static ConstraintExpr or(ConstraintExpr... operands) {
        return or(Arrays.asList(operands));
    }

    /**
     * Disjunction; an empty list is {@link #FALSE}, a single operand is returned as is.
     */
    static ConstraintExpr or(List<ConstraintExpr> operands) {
        if (operands.isEmpty()) return FALSE;
        if (operands.size() == 1) return operands.get(0);
        return new Or(new ArrayList<>(operands));
    }

    static ConstraintExpr not(ConstraintExpr operand) {
        return new Not(operand);
    }

    private static void requireSort(Variable variable, VariableSort sort) {
        Objects.requireNonNull(variable, "variable");
        if (variable.sort() != sort) {
            throw new IllegalArgumentException("expected " + sort + " variable, got " + variable);
        }
    }
}
