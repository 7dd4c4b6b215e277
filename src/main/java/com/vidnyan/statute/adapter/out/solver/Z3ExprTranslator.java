package com.vidnyan.statute.adapter.out.solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.vidnyan.statute.domain.constraint.ConstraintExpr;
import com.vidnyan.statute.domain.constraint.DomainBounds;
import com.vidnyan.statute.domain.constraint.Interval;
import com.vidnyan.statute.domain.constraint.Model;
import com.vidnyan.statute.domain.constraint.Variable;
import com.vidnyan.statute.domain.model.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds Z3 formulas for one query and reads models back.
 *
 * <p>String variables become integers: each literal compared against a variable gets
 * a code, and the code one past the last literal stands for "any other string".
 * Opaque atoms become free boolean constants.
 */
final class Z3ExprTranslator {

    private final Context ctx;
    private final DomainBounds bounds;
    private final Map<Variable, IntExpr> ints = new HashMap<>();
    private final Map<Variable, BoolExpr> bools = new HashMap<>();
    private final Map<Variable, IntExpr> strings = new HashMap<>();
    private final Map<Variable, Map<String, Integer>> stringCodes = new HashMap<>();
    private boolean opaque;

    Z3ExprTranslator(Context ctx, DomainBounds bounds) {
        this.ctx = ctx;
        this.bounds = bounds;
    }

    BoolExpr translate(ConstraintExpr expr) {
        if (expr instanceof ConstraintExpr.Const c) {
            return c.value() ? ctx.mkTrue() : ctx.mkFalse();
        }
        if (expr instanceof ConstraintExpr.IntCompare cmp) {
            IntExpr var = ints.computeIfAbsent(cmp.variable(), v -> ctx.mkIntConst(v.toString()));
            IntNum value = ctx.mkInt(cmp.value());
            return switch (cmp.op()) {
                case EQUAL -> ctx.mkEq(var, value);
                case NOT_EQUAL -> ctx.mkNot(ctx.mkEq(var, value));
                case LESS_THAN -> ctx.mkLt(var, value);
                case LESS_OR_EQUAL -> ctx.mkLe(var, value);
                case GREATER_THAN -> ctx.mkGt(var, value);
                case GREATER_OR_EQUAL -> ctx.mkGe(var, value);
            };
        }
        if (expr instanceof ConstraintExpr.BoolAtom atom) {
            return bools.computeIfAbsent(atom.variable(), v -> ctx.mkBoolConst(v.toString()));
        }
        if (expr instanceof ConstraintExpr.StringEquals eq) {
            IntExpr var = strings.computeIfAbsent(eq.variable(), v -> ctx.mkIntConst(v.toString()));
            Map<String, Integer> codes = stringCodes.computeIfAbsent(eq.variable(), v -> new LinkedHashMap<>());
            int code = codes.computeIfAbsent(eq.value(), v -> codes.size());
            return ctx.mkEq(var, ctx.mkInt(code));
        }
        if (expr instanceof ConstraintExpr.Opaque o) {
            opaque = true;
            return ctx.mkBoolConst("opaque " + o.key());
        }
        if (expr instanceof ConstraintExpr.Not not) {
            return ctx.mkNot(translate(not.operand()));
        }
        if (expr instanceof ConstraintExpr.And and) {
            return ctx.mkAnd(translateAll(and.operands()));
        }
        if (expr instanceof ConstraintExpr.Or or) {
            return ctx.mkOr(translateAll(or.operands()));
        }
        throw new IllegalArgumentException("unsupported constraint " + expr);
    }

    /**
     * Domain constraints for every variable seen so far. Call after {@link #translate}.
     */
    List<BoolExpr> domainConstraints() {
        List<BoolExpr> constraints = new ArrayList<>();
        ints.forEach((variable, expr) -> {
            Interval interval = bounds.intervalFor(variable);
            constraints.add(ctx.mkGe(expr, ctx.mkInt(interval.low())));
            constraints.add(ctx.mkLe(expr, ctx.mkInt(interval.high())));
        });
        strings.forEach((variable, expr) -> {
            constraints.add(ctx.mkGe(expr, ctx.mkInt(0)));
            constraints.add(ctx.mkLe(expr, ctx.mkInt(stringCodes.get(variable).size())));
        });
        return constraints;
    }

    boolean usesOpaque() {
        return opaque;
    }

    Set<Variable> variables() {
        Set<Variable> all = new TreeSet<>(ints.keySet());
        all.addAll(bools.keySet());
        all.addAll(strings.keySet());
        return all;
    }

    Model readModel(com.microsoft.z3.Model z3Model) {
        Map<String, Value> values = new HashMap<>();
        ints.forEach((variable, expr) ->
                values.put(variable.name(), Value.of(((IntNum) z3Model.eval(expr, true)).getInt64())));
        bools.forEach((variable, expr) ->
                values.put(variable.name(), Value.of(z3Model.eval(expr, true).isTrue())));
        strings.forEach((variable, expr) -> {
            int code = ((IntNum) z3Model.eval(expr, true)).getInt();
            values.put(variable.name(), Value.of(decodeString(stringCodes.get(variable), code)));
        });
        return new Model(values);
    }

    private static String decodeString(Map<String, Integer> codes, int code) {
        for (Map.Entry<String, Integer> entry : codes.entrySet()) {
            if (entry.getValue() == code) {
                return entry.getKey();
            }
        }
        String candidate = "other";
        for (int i = 1; codes.containsKey(candidate); i++) {
            candidate = "other" + i;
        }
        return candidate;
    }

    private BoolExpr[] translateAll(List<ConstraintExpr> operands) {
        BoolExpr[] translated = new BoolExpr[operands.size()];
        for (int i = 0; i < operands.size(); i++) {
            translated[i] = translate(operands.get(i));
        }
        return translated;
    }
}
