package com.vidnyan.statute.domain.constraint;

import com.vidnyan.statute.domain.dsl.StatutePrinter;
import com.vidnyan.statute.domain.model.ComparisonOp;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.ConditionVisitor;
import com.vidnyan.statute.domain.model.Value;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translates conditions into solver-neutral constraints.
 *
 * <p>Variable naming:
 * <ul>
 *   <li>{@code age}, {@code income}: integers</li>
 *   <li>{@code date}: integer epoch days</li>
 *   <li>{@code has:<name>}: boolean per attribute</li>
 *   <li>{@code region:<kind>}: string, lower-cased</li>
 *   <li>{@code attr:<name>}: any other attribute in BETWEEN/IN, integer or string by literal type</li>
 * </ul>
 * {@code AGE BETWEEN} and {@code INCOME BETWEEN} reuse {@code age} and {@code income}.
 * LIKE and mixed-type IN lists become opaque atoms keyed by their printed form.
 */
public final class ConstraintEncoder {

    public static final String AGE = "age";
    public static final String INCOME = "income";
    public static final String DATE = "date";
    public static final String HAS_PREFIX = "has:";
    public static final String REGION_PREFIX = "region:";
    public static final String ATTR_PREFIX = "attr:";

    public ConstraintExpr encode(Condition condition) {
        return condition.accept(ENCODER);
    }

    /**
     * Map a solver model back to fact values; {@code date} becomes a calendar date.
     */
    public Model decode(Model raw) {
        Map<String, Value> decoded = new HashMap<>(raw.assignments());
        raw.get(DATE).ifPresent(v -> {
            if (v instanceof Value.IntValue days) {
                decoded.put(DATE, Value.of(LocalDate.ofEpochDay(days.value())));
            }
        });
        return new Model(decoded);
    }

    /**
     * Entity attribute a variable stands for. Distinct variables can name the same fact,
     * for instance {@code has:x} and {@code attr:x}.
     */
    public static String factName(Variable variable) {
        String name = variable.name();
        if (name.startsWith(HAS_PREFIX)) {
            return name.substring(HAS_PREFIX.length());
        }
        if (name.startsWith(ATTR_PREFIX)) {
            return name.substring(ATTR_PREFIX.length());
        }
        if (name.startsWith(REGION_PREFIX)) {
            return name.substring(REGION_PREFIX.length());
        }
        return name;
    }

    /**
     * Whether two of the variables stand for the same entity fact.
     */
    public static boolean sharesFact(Collection<Variable> variables) {
        Set<String> facts = new HashSet<>();
        for (Variable variable : variables) {
            if (!facts.add(factName(variable))) {
                return true;
            }
        }
        return false;
    }

    private static Variable attributeVar(String attribute, VariableSort sort) {
        return new Variable(ATTR_PREFIX + attribute, sort);
    }

    private static final ConditionVisitor<ConstraintExpr> ENCODER = new ConditionVisitor<>() {

        @Override
        public ConstraintExpr visitAge(Condition.Age age) {
            return new ConstraintExpr.IntCompare(Variable.intVar(AGE), age.op(), age.value());
        }

        @Override
        public ConstraintExpr visitIncome(Condition.Income income) {
            return new ConstraintExpr.IntCompare(Variable.intVar(INCOME), income.op(), income.value());
        }

        @Override
        public ConstraintExpr visitDate(Condition.DateCompare date) {
            return new ConstraintExpr.IntCompare(Variable.intVar(DATE), date.op(), date.value().toEpochDay());
        }

        @Override
        public ConstraintExpr visitHasAttribute(Condition.HasAttribute has) {
            return new ConstraintExpr.BoolAtom(Variable.boolVar(HAS_PREFIX + has.name()));
        }

        @Override
        public ConstraintExpr visitGeographic(Condition.Geographic geographic) {
            return new ConstraintExpr.StringEquals(
                    Variable.stringVar(REGION_PREFIX + geographic.kind().attributeKey()),
                    geographic.value().toLowerCase(Locale.ROOT));
        }

        @Override
        public ConstraintExpr visitBetween(Condition.Between between) {
            Variable var = AGE.equals(between.attribute()) || INCOME.equals(between.attribute())
                    ? Variable.intVar(between.attribute())
                    : attributeVar(between.attribute(), VariableSort.INT);
            return ConstraintExpr.and(
                    new ConstraintExpr.IntCompare(var, ComparisonOp.GREATER_OR_EQUAL, between.low()),
                    new ConstraintExpr.IntCompare(var, ComparisonOp.LESS_OR_EQUAL, between.high()));
        }

        @Override
        public ConstraintExpr visitIn(Condition.In in) {
            List<Value> values = in.values();
            if (values.stream().allMatch(v -> v instanceof Value.IntValue)) {
                Variable var = attributeVar(in.attribute(), VariableSort.INT);
                return ConstraintExpr.or(values.stream()
                        .map(v -> (ConstraintExpr) new ConstraintExpr.IntCompare(
                                var, ComparisonOp.EQUAL, ((Value.IntValue) v).value()))
                        .collect(Collectors.toList()));
            }
            if (values.stream().allMatch(v -> v instanceof Value.DateValue)) {
                Variable var = attributeVar(in.attribute(), VariableSort.INT);
                return ConstraintExpr.or(values.stream()
                        .map(v -> (ConstraintExpr) new ConstraintExpr.IntCompare(
                                var, ComparisonOp.EQUAL, ((Value.DateValue) v).value().toEpochDay()))
                        .collect(Collectors.toList()));
            }
            if (values.stream().allMatch(v -> v instanceof Value.StringValue)) {
                Variable var = attributeVar(in.attribute(), VariableSort.STRING);
                return ConstraintExpr.or(values.stream()
                        .map(v -> (ConstraintExpr) new ConstraintExpr.StringEquals(var, ((Value.StringValue) v).value()))
                        .collect(Collectors.toList()));
            }
            return new ConstraintExpr.Opaque(StatutePrinter.printCondition(in));
        }

        @Override
        public ConstraintExpr visitLike(Condition.Like like) {
            return new ConstraintExpr.Opaque(StatutePrinter.printCondition(like));
        }

        @Override
        public ConstraintExpr visitAnd(Condition.And and) {
            return new ConstraintExpr.And(encodeAll(and.operands()));
        }

        @Override
        public ConstraintExpr visitOr(Condition.Or or) {
            return new ConstraintExpr.Or(encodeAll(or.operands()));
        }

        @Override
        public ConstraintExpr visitNot(Condition.Not not) {
            return new ConstraintExpr.Not(not.operand().accept(this));
        }

        private List<ConstraintExpr> encodeAll(List<Condition> operands) {
            return operands.stream()
                    .map(c -> c.accept(this))
                    .collect(Collectors.toList());
        }
    };
}
