package com.vidnyan.statute.domain.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Boolean-valued predicate tree evaluated against entity facts.
 * Immutable; trees are built bottom-up, so they are finite and acyclic.
 */
public sealed interface Condition {

    <R> R accept(ConditionVisitor<R> visitor);

    /**
     * Age comparison, e.g. {@code AGE >= 18}.
     */
    record Age(ComparisonOp op, long value) implements Condition {
        public Age {
            Objects.requireNonNull(op, "op");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitAge(this);
        }
    }

    /**
     * Income comparison, e.g. {@code INCOME < 30000}.
     */
    record Income(ComparisonOp op, long value) implements Condition {
        public Income {
            Objects.requireNonNull(op, "op");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitIncome(this);
        }
    }

    /**
     * Comparison against the evaluation date, e.g. {@code DATE >= 2025-01-01}.
     */
    record DateCompare(ComparisonOp op, LocalDate value) implements Condition {
        public DateCompare {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitDate(this);
        }
    }

    record HasAttribute(String name) implements Condition {
        public HasAttribute {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitHasAttribute(this);
        }
    }

    record Geographic(RegionType kind, String value) implements Condition {
        public Geographic {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitGeographic(this);
        }
    }

    /**
     * Inclusive numeric range over a named attribute.
     */
    record Between(String attribute, long low, long high) implements Condition {
        public Between {
            Objects.requireNonNull(attribute, "attribute");
            if (low > high) {
                throw new IllegalArgumentException("empty range " + low + ".." + high);
            }
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitBetween(this);
        }
    }

    /**
     * Set membership over a named attribute.
     */
    record In(String attribute, List<Value> values) implements Condition {
        public In {
            Objects.requireNonNull(attribute, "attribute");
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("IN requires at least one value");
            }
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitIn(this);
        }
    }

    /**
     * SQL-style pattern match ({@code %} and {@code _}) over a string attribute.
     */
    record Like(String attribute, String pattern) implements Condition {
        public Like {
            Objects.requireNonNull(attribute, "attribute");
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitLike(this);
        }
    }

    record And(List<Condition> operands) implements Condition {
        public And {
            operands = List.copyOf(operands);
            if (operands.size() < 2) {
                throw new IllegalArgumentException("AND requires at least two operands");
            }
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }
    }

    record Or(List<Condition> operands) implements Condition {
        public Or {
            operands = List.copyOf(operands);
            if (operands.size() < 2) {
                throw new IllegalArgumentException("OR requires at least two operands");
            }
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitOr(this);
        }
    }

    record Not(Condition operand) implements Condition {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    static Condition age(ComparisonOp op, long value) {
        return new Age(op, value);
    }

    static Condition income(ComparisonOp op, long value) {
        return new Income(op, value);
    }

    static Condition date(ComparisonOp op, LocalDate value) {
        return new DateCompare(op, value);
    }

    static Condition has(String name) {
        return new HasAttribute(name);
    }

    static Condition region(RegionType kind, String value) {
        return new Geographic(kind, value);
    }

    static Condition and(Condition... operands) {
        return new And(Arrays.asList(operands));
    }

    static Condition or(Condition... operands) {
        return new Or(Arrays.asList(operands));
    }

    static Condition not(Condition operand) {
        return new Not(operand);
    }
}
