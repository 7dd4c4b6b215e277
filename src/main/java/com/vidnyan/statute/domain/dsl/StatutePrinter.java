package com.vidnyan.statute.domain.dsl;

import com.vidnyan.statute.domain.model.Condition;
import com.vidnyan.statute.domain.model.ConditionVisitor;
import com.vidnyan.statute.domain.model.Statute;
import com.vidnyan.statute.domain.model.Value;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders statutes back to canonical DSL text.
 * Output re-parses to a structurally equal statute. Parentheses are emitted
 * only where precedence or explicit nesting needs them.
 */
public final class StatutePrinter {

    private static final String INDENT = "    ";
    private static final Pattern BARE_IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private StatutePrinter() {}

    public static String print(Statute statute) {
        StringBuilder sb = new StringBuilder();
        sb.append("STATUTE ").append(statute.id()).append(": ").append(quote(statute.title())).append(" {\n");
        statute.jurisdiction().ifPresent(j -> line(sb, "JURISDICTION " + quote(j)));
        line(sb, "VERSION " + statute.version());
        statute.temporalValidity().effectiveDate().ifPresent(d -> line(sb, "EFFECTIVE_DATE " + d));
        statute.temporalValidity().expiryDate().ifPresent(d -> line(sb, "EXPIRY_DATE " + d));
        if (!statute.supersedes().isEmpty()) {
            line(sb, "SUPERSEDES " + String.join(", ", statute.supersedes()));
        }
        if (!statute.amends().isEmpty()) {
            line(sb, "AMENDMENT " + String.join(", ", statute.amends()));
        }
        line(sb, "WHEN " + printCondition(statute.preconditions()));
        line(sb, "THEN " + statute.primaryEffect().kind().name() + " " + quote(statute.primaryEffect().description()));
        statute.exception().ifPresent(e -> line(sb, "EXCEPTION WHEN " + printCondition(e)));
        statute.discretionNote().ifPresent(n -> line(sb, "DISCRETION " + quote(n)));
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Render several statutes as one source unit, separated by blank lines.
     */
    public static String printAll(List<Statute> statutes) {
        return statutes.stream()
                .map(StatutePrinter::print)
                .collect(Collectors.joining("\n"));
    }

    public static String printCondition(Condition condition) {
        return condition.accept(RENDERER);
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(INDENT).append(text).append('\n');
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static String name(String name) {
        if (BARE_IDENT.matcher(name).matches() && TokenType.keyword(name).isEmpty()) {
            return name;
        }
        return quote(name);
    }

    private static String literal(Value value) {
        if (value instanceof Value.StringValue s) {
            return quote(s.value());
        }
        return value.toString();
    }

    private static final ConditionVisitor<String> RENDERER = new ConditionVisitor<>() {

        @Override
        public String visitAge(Condition.Age age) {
            return "AGE " + age.op().symbol() + " " + age.value();
        }

        @Override
        public String visitIncome(Condition.Income income) {
            return "INCOME " + income.op().symbol() + " " + income.value();
        }

        @Override
        public String visitDate(Condition.DateCompare date) {
            return "DATE " + date.op().symbol() + " " + date.value();
        }

        @Override
        public String visitHasAttribute(Condition.HasAttribute has) {
            return "HAS " + name(has.name());
        }

        @Override
        public String visitGeographic(Condition.Geographic geographic) {
            return "REGION " + geographic.kind().attributeKey() + " " + quote(geographic.value());
        }

        @Override
        public String visitBetween(Condition.Between between) {
            return between.attribute() + " BETWEEN " + between.low() + " AND " + between.high();
        }

        @Override
        public String visitIn(Condition.In in) {
            return in.attribute() + " IN (" + in.values().stream()
                    .map(StatutePrinter::literal)
                    .collect(Collectors.joining(", ")) + ")";
        }

        @Override
        public String visitLike(Condition.Like like) {
            return like.attribute() + " LIKE " + quote(like.pattern());
        }

        @Override
        public String visitAnd(Condition.And and) {
            // And inside And is explicit nesting, Or inside And is precedence
            return and.operands().stream()
                    .map(c -> isConnective(c) ? "(" + c.accept(this) + ")" : c.accept(this))
                    .collect(Collectors.joining(" AND "));
        }

        @Override
        public String visitOr(Condition.Or or) {
            return or.operands().stream()
                    .map(c -> c instanceof Condition.Or ? "(" + c.accept(this) + ")" : c.accept(this))
                    .collect(Collectors.joining(" OR "));
        }

        @Override
        public String visitNot(Condition.Not not) {
            Condition operand = not.operand();
            return isConnective(operand) ? "NOT (" + operand.accept(this) + ")" : "NOT " + operand.accept(this);
        }

        private boolean isConnective(Condition c) {
            return c instanceof Condition.And || c instanceof Condition.Or;
        }
    };
}
