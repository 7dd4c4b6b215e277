package com.vidnyan.statute.domain.constraint;

import java.util.Objects;

/**
 * Answer of a satisfiability check. {@code Unknown} is never to be read as either of the others.
 */
public sealed interface SatResult {

    record Sat(Model model) implements SatResult {
        public Sat {
            Objects.requireNonNull(model, "model");
        }
    }

    record Unsat() implements SatResult {}

    record Unknown(String reason) implements SatResult {
        public Unknown {
            Objects.requireNonNull(reason, "reason");
        }
    }

    static SatResult sat(Model model) {
        return new Sat(model);
    }

    static SatResult unsat() {
        return new Unsat();
    }

    static SatResult unknown(String reason) {
        return new Unknown(reason);
    }

    default boolean isSat() {
        return this instanceof Sat;
    }

    default boolean isUnsat() {
        return this instanceof Unsat;
    }

    default boolean isUnknown() {
        return this instanceof Unknown;
    }
}
