package com.vidnyan.statute.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Outcome of applying a statute to an entity.
 * Exactly one of: a mechanically derived value, a case that needs a human
 * decision, or an inapplicable/void outcome.
 */
public sealed interface LegalResult<T> {

    record Deterministic<T>(T value) implements LegalResult<T> {
        public Deterministic {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * The facts do not settle the outcome; a human decision-maker must.
     */
    record JudicialDiscretion<T>(
        String issue,
        UUID contextId,
        Optional<String> narrativeHint
    ) implements LegalResult<T> {
        public JudicialDiscretion {
            Objects.requireNonNull(issue, "issue");
            Objects.requireNonNull(contextId, "contextId");
            Objects.requireNonNull(narrativeHint, "narrativeHint");
        }
    }

    record Void<T>(String reason) implements LegalResult<T> {
        public Void {
            Objects.requireNonNull(reason, "reason");
        }
    }

    static <T> LegalResult<T> deterministic(T value) {
        return new Deterministic<>(value);
    }

    static <T> LegalResult<T> discretion(String issue, UUID contextId, Optional<String> hint) {
        return new JudicialDiscretion<>(issue, contextId, hint);
    }

    static <T> LegalResult<T> voided(String reason) {
        return new Void<>(reason);
    }

    default boolean isDeterministic() {
        return this instanceof Deterministic;
    }

    default boolean requiresDiscretion() {
        return this instanceof JudicialDiscretion;
    }

    default boolean isVoid() {
        return this instanceof Void;
    }

    /**
     * Transform the deterministic value; the other variants carry over unchanged.
     */
    default <U> LegalResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Deterministic<T> d) {
            return new Deterministic<>(mapper.apply(d.value()));
        }
        if (this instanceof JudicialDiscretion<T> j) {
            return new JudicialDiscretion<>(j.issue(), j.contextId(), j.narrativeHint());
        }
        return new Void<>(((Void<T>) this).reason());
    }
}
