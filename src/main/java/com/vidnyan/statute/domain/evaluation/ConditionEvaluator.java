package com.vidnyan.statute.domain.evaluation;

import com.vidnyan.statute.domain.model.ComparisonOp;
import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.ConditionVisitor;
import com.vidnyan.statute.domain.model.Value;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Evaluates a condition tree against an {@link EvaluationContext} in four-valued logic.
 *
 * <p>A leaf whose attribute is missing, or present with the wrong type, is UNKNOWN.
 * Connectives reduce over every operand, so operand order never changes the result.
 * Stateless and safe to share between threads.
 */
public final class ConditionEvaluator {

    public PartialBool evaluate(Condition condition, EvaluationContext context) {
        return condition.accept(new LeafVisitor(context));
    }

    /**
     * Translate a SQL LIKE pattern into a regex: {@code %} is any run, {@code _} one character.
     */
    static Pattern likePattern(String pattern) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static final class LeafVisitor implements ConditionVisitor<PartialBool> {

        private final EvaluationContext context;

        LeafVisitor(EvaluationContext context) {
            this.context = context;
        }

        @Override
        public PartialBool visitAge(Condition.Age age) {
            return compareInt("age", age.op(), age.value());
        }

        @Override
        public PartialBool visitIncome(Condition.Income income) {
            return compareInt("income", income.op(), income.value());
        }

        @Override
        public PartialBool visitDate(Condition.DateCompare date) {
            Optional<Value> fact = context.getAttribute("date");
            if (fact.isPresent() && fact.get() instanceof Value.DateValue d) {
                return PartialBool.of(date.op().test(d.value(), date.value()));
            }
            return PartialBool.UNKNOWN;
        }

        @Override
        public PartialBool visitHasAttribute(Condition.HasAttribute has) {
            Optional<Value> fact = context.getAttribute(has.name());
            if (fact.isEmpty()) {
                return PartialBool.UNKNOWN;
            }
            if (fact.get() instanceof Value.BoolValue b) {
                return PartialBool.of(b.value());
            }
            return PartialBool.TRUE;
        }

        @Override
        public PartialBool visitGeographic(Condition.Geographic geographic) {
            Optional<Value> fact = context.getAttribute(geographic.kind().attributeKey());
            if (fact.isPresent() && fact.get() instanceof Value.StringValue s) {
                return PartialBool.of(s.value().equalsIgnoreCase(geographic.value()));
            }
            return PartialBool.UNKNOWN;
        }

        @Override
        public PartialBool visitBetween(Condition.Between between) {
            Optional<Value> fact = context.getAttribute(between.attribute());
            if (fact.isPresent() && fact.get() instanceof Value.IntValue i) {
                return PartialBool.of(i.value() >= between.low() && i.value() <= between.high());
            }
            return PartialBool.UNKNOWN;
        }

        @Override
        public PartialBool visitIn(Condition.In in) {
            Optional<Value> fact = context.getAttribute(in.attribute());
            if (fact.isEmpty()) {
                return PartialBool.UNKNOWN;
            }
            Value actual = fact.get();
            boolean comparable = false;
            for (Value candidate : in.values()) {
                if (candidate.getClass() == actual.getClass()) {
                    comparable = true;
                    if (candidate.equals(actual)) {
                        return PartialBool.TRUE;
                    }
                }
            }
            return comparable ? PartialBool.FALSE : PartialBool.UNKNOWN;
        }

        @Override
        public PartialBool visitLike(Condition.Like like) {
            Optional<Value> fact = context.getAttribute(like.attribute());
            if (fact.isPresent() && fact.get() instanceof Value.StringValue s) {
                return PartialBool.of(likePattern(like.pattern()).matcher(s.value()).matches());
            }
            return PartialBool.UNKNOWN;
        }

        @Override
        public PartialBool visitAnd(Condition.And and) {
            return PartialBool.all(evaluateAll(and.operands()));
        }

        @Override
        public PartialBool visitOr(Condition.Or or) {
            return PartialBool.any(evaluateAll(or.operands()));
        }

        @Override
        public PartialBool visitNot(Condition.Not not) {
            return not.operand().accept(this).not();
        }

        private List<PartialBool> evaluateAll(List<Condition> operands) {
            return operands.stream()
                    .map(c -> c.accept(this))
                    .collect(Collectors.toList());
        }

        private PartialBool compareInt(String attribute, ComparisonOp op, long literal) {
            Optional<Value> fact = context.getAttribute(attribute);
            if (fact.isPresent() && fact.get() instanceof Value.IntValue i) {
                return PartialBool.of(op.test(i.value(), literal));
            }
            return PartialBool.UNKNOWN;
        }
    }
}
