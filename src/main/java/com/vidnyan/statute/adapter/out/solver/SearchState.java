package com.vidnyan.statute.adapter.out.solver;

import com.vidnyan.statute.domain.constraint.ConstraintEncoder;
import com.vidnyan.statute.domain.constraint.DomainBounds;
import com.vidnyan.statute.domain.constraint.Interval;
import com.vidnyan.statute.domain.constraint.Model;
import com.vidnyan.statute.domain.constraint.Variable;
import com.vidnyan.statute.domain.model.ComparisonOp;
import com.vidnyan.statute.domain.model.Value;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Partial assignment explored by {@link BoundedDomainSolver}: one domain per touched variable.
 * Every {@code require*} method narrows a domain and reports whether it is still non-empty.
 */
final class SearchState {

    private final DomainBounds bounds;
    private final Map<Variable, IntDomain> ints;
    private final Map<Variable, StringDomain> strings;
    private final Map<Variable, Boolean> bools;
    private final Map<String, Boolean> opaque;

    SearchState(DomainBounds bounds) {
        this(bounds, new HashMap<>(), new HashMap<>(), new HashMap<>(), new HashMap<>());
    }

    private SearchState(DomainBounds bounds, Map<Variable, IntDomain> ints, Map<Variable, StringDomain> strings,
                        Map<Variable, Boolean> bools, Map<String, Boolean> opaque) {
        this.bounds = bounds;
        this.ints = ints;
        this.strings = strings;
        this.bools = bools;
        this.opaque = opaque;
    }

    SearchState copy() {
        Map<Variable, IntDomain> intCopy = new HashMap<>();
        ints.forEach((k, v) -> intCopy.put(k, v.copy()));
        Map<Variable, StringDomain> stringCopy = new HashMap<>();
        strings.forEach((k, v) -> stringCopy.put(k, v.copy()));
        return new SearchState(bounds, intCopy, stringCopy, new HashMap<>(bools), new HashMap<>(opaque));
    }

    boolean requireInt(Variable var, ComparisonOp op, long value) {
        IntDomain domain = ints.computeIfAbsent(var, v -> new IntDomain(bounds.intervalFor(v)));
        return domain.narrow(op, value);
    }

    boolean requireBool(Variable var, boolean value) {
        Boolean existing = bools.putIfAbsent(var, value);
        return existing == null || existing == value;
    }

    boolean requireString(Variable var, String value, boolean equal) {
        StringDomain domain = strings.computeIfAbsent(var, v -> new StringDomain());
        return equal ? domain.fix(value) : domain.exclude(value);
    }

    boolean requireOpaque(String key, boolean value) {
        Boolean existing = opaque.putIfAbsent(key, value);
        return existing == null || existing == value;
    }

    boolean usesOpaque() {
        return !opaque.isEmpty();
    }

    /**
     * Whether two distinct variables stand for one entity fact, such as {@code x} as an
     * integer and as a string. Their values were chosen independently, so no single
     * entity need realise them.
     */
    boolean hasSharedFact() {
        Set<Variable> variables = new HashSet<>(ints.keySet());
        variables.addAll(strings.keySet());
        variables.addAll(bools.keySet());
        return ConstraintEncoder.sharesFact(variables);
    }

    Model toModel() {
        Map<String, Value> values = new HashMap<>();
        ints.forEach((var, domain) -> values.put(var.name(), Value.of(domain.pick())));
        strings.forEach((var, domain) -> values.put(var.name(), Value.of(domain.pick())));
        bools.forEach((var, value) -> values.put(var.name(), Value.of(value)));
        return new Model(values);
    }

    /**
     * Interval minus a finite set of excluded points.
     */
    static final class IntDomain {
        private Interval interval;
        private final Set<Long> excluded;

        IntDomain(Interval interval) {
            this(interval, new HashSet<>());
        }

        private IntDomain(Interval interval, Set<Long> excluded) {
            this.interval = interval;
            this.excluded = excluded;
        }

        IntDomain copy() {
            return new IntDomain(interval, new HashSet<>(excluded));
        }

        boolean narrow(ComparisonOp op, long value) {
            switch (op) {
                case EQUAL -> interval = interval.intersect(Interval.of(value, value));
                case NOT_EQUAL -> excluded.add(value);
                case LESS_THAN -> interval = value == Long.MIN_VALUE
                        ? Interval.of(1, 0)
                        : interval.intersect(Interval.of(Long.MIN_VALUE, value - 1));
                case LESS_OR_EQUAL -> interval = interval.intersect(Interval.of(Long.MIN_VALUE, value));
                case GREATER_THAN -> interval = value == Long.MAX_VALUE
                        ? Interval.of(1, 0)
                        : interval.intersect(Interval.of(value + 1, Long.MAX_VALUE));
                case GREATER_OR_EQUAL -> interval = interval.intersect(Interval.of(value, Long.MAX_VALUE));
            }
            return !isEmpty();
        }

        boolean isEmpty() {
            if (interval.isEmpty()) {
                return true;
            }
            long inside = excluded.stream().filter(interval::contains).count();
            // unsigned width avoids overflow on the full long range
            return Long.compareUnsigned(interval.high() - interval.low(), inside) < 0;
        }

        /**
         * Member closest to zero, searching upward first.
         */
        long pick() {
            long start = Math.max(interval.low(), Math.min(interval.high(), 0L));
            for (long v = start; v <= interval.high(); v++) {
                if (!excluded.contains(v)) {
                    return v;
                }
                if (v == Long.MAX_VALUE) break;
            }
            for (long v = start; v >= interval.low(); v--) {
                if (!excluded.contains(v)) {
                    return v;
                }
                if (v == Long.MIN_VALUE) break;
            }
            throw new IllegalStateException("empty domain " + interval);
        }
    }

    /**
     * Either one fixed string, or anything outside an excluded set.
     */
    static final class StringDomain {
        private String fixed;
        private final Set<String> excluded;

        StringDomain() {
            this(null, new HashSet<>());
        }

        private StringDomain(String fixed, Set<String> excluded) {
            this.fixed = fixed;
            this.excluded = excluded;
        }

        StringDomain copy() {
            return new StringDomain(fixed, new HashSet<>(excluded));
        }

        boolean fix(String value) {
            if (fixed != null && !fixed.equals(value)) {
                return false;
            }
            fixed = value;
            return !excluded.contains(value);
        }

        boolean exclude(String value) {
            excluded.add(value);
            return fixed == null || !fixed.equals(value);
        }

        String pick() {
            if (fixed != null) {
                return fixed;
            }
            String candidate = "other";
            for (int i = 1; excluded.contains(candidate); i++) {
                candidate = "other" + i;
            }
            return candidate;
        }
    }
}
