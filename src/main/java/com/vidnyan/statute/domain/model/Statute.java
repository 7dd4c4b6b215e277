package com.vidnyan.statute.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A single enacted rule: preconditions, a primary effect, an optional exception
 * and its metadata. Cross-statute links are held as ids only.
 * Immutable value object.
 */
public record Statute(
    String id,
    String title,
    Optional<String> jurisdiction,
    int version,
    TemporalValidity temporalValidity,
    Condition preconditions,
    Effect primaryEffect,
    Optional<Condition> exception,
    Optional<String> discretionNote,
    List<String> supersedes,
    List<String> amends
) {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_-]*");
    private static final long MAX_REALISTIC_AGE = 150;

    public Statute {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(jurisdiction, "jurisdiction");
        Objects.requireNonNull(temporalValidity, "temporalValidity");
        Objects.requireNonNull(preconditions, "preconditions");
        Objects.requireNonNull(primaryEffect, "primaryEffect");
        Objects.requireNonNull(exception, "exception");
        Objects.requireNonNull(discretionNote, "discretionNote");
        supersedes = List.copyOf(supersedes);
        amends = List.copyOf(amends);
    }

    /**
     * Check whether the statute is in force on the given date.
     */
    public boolean isActive(LocalDate asOf) {
        return temporalValidity.isActive(asOf);
    }

    /**
     * Ids of all statutes this one references through supersession or amendment.
     */
    public List<String> references() {
        List<String> refs = new ArrayList<>(supersedes);
        refs.addAll(amends);
        return refs;
    }

    /**
     * Collect structural problems. An empty list means the statute is well-formed.
     */
    public List<StatuteValidationError> validate() {
        List<StatuteValidationError> errors = new ArrayList<>();
        if (id.isBlank()) {
            errors.add(new StatuteValidationError(StatuteValidationError.Code.EMPTY_ID,
                    "statute id must not be empty"));
        } else if (!ID_PATTERN.matcher(id).matches()) {
            errors.add(new StatuteValidationError(StatuteValidationError.Code.INVALID_ID,
                    "statute id '" + id + "' must start with a letter and contain only letters, digits, '-' or '_'"));
        }
        if (title.isBlank()) {
            errors.add(new StatuteValidationError(StatuteValidationError.Code.EMPTY_TITLE,
                    "statute title must not be empty"));
        }
        if (primaryEffect.description().isBlank()) {
            errors.add(new StatuteValidationError(StatuteValidationError.Code.EMPTY_EFFECT_DESCRIPTION,
                    "effect description must not be empty"));
        }
        if (version < 1) {
            errors.add(new StatuteValidationError(StatuteValidationError.Code.INVALID_VERSION,
                    "version must be at least 1, was " + version));
        }
        List<Condition> trees = new ArrayList<>();
        trees.add(preconditions);
        exception.ifPresent(trees::add);
        for (Condition tree : trees) {
            collectAges(tree, errors);
        }
        return errors;
    }

    public boolean isValid() {
        return validate().isEmpty();
    }

    private static void collectAges(Condition condition, List<StatuteValidationError> errors) {
        if (condition instanceof Condition.Age age) {
            if (age.value() > MAX_REALISTIC_AGE) {
                errors.add(new StatuteValidationError(StatuteValidationError.Code.UNREALISTIC_AGE,
                        "age " + age.value() + " exceeds " + MAX_REALISTIC_AGE));
            }
        } else if (condition instanceof Condition.And and) {
            and.operands().forEach(c -> collectAges(c, errors));
        } else if (condition instanceof Condition.Or or) {
            or.operands().forEach(c -> collectAges(c, errors));
        } else if (condition instanceof Condition.Not not) {
            collectAges(not.operand(), errors);
        }
    }

    /**
     * Builder for Statute.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String jurisdiction;
        private int version = 1;
        private LocalDate effectiveDate;
        private LocalDate expiryDate;
        private Condition preconditions;
        private Effect primaryEffect;
        private Condition exception;
        private String discretionNote;
        private final List<String> supersedes = new ArrayList<>();
        private final List<String> amends = new ArrayList<>();

        public Builder id(String id) { this.id = id; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder jurisdiction(String jurisdiction) { this.jurisdiction = jurisdiction; return this; }
        public Builder version(int version) { this.version = version; return this; }
        public Builder effectiveDate(LocalDate date) { this.effectiveDate = date; return this; }
        public Builder expiryDate(LocalDate date) { this.expiryDate = date; return this; }
        public Builder preconditions(Condition condition) { this.preconditions = condition; return this; }
        public Builder effect(Effect effect) { this.primaryEffect = effect; return this; }
        public Builder exception(Condition condition) { this.exception = condition; return this; }
        public Builder discretionNote(String note) { this.discretionNote = note; return this; }
        public Builder supersedes(String id) { this.supersedes.add(id); return this; }
        public Builder amends(String id) { this.amends.add(id); return this; }

        public Statute build() {
            return new Statute(id, title, Optional.ofNullable(jurisdiction), version,
                    TemporalValidity.of(effectiveDate, expiryDate), preconditions, primaryEffect,
                    Optional.ofNullable(exception), Optional.ofNullable(discretionNote),
                    supersedes, amends);
        }
    }
}
