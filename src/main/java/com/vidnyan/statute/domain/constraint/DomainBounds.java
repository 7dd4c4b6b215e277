package com.vidnyan.statute.domain.constraint;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Finite domains for the well-known integer variables.
 * Every other integer variable ranges over all {@code long} values.
 */
public record DomainBounds(
    Interval age,
    Interval income,
    LocalDate earliestDate,
    LocalDate latestDate
) {

    public static final long DEFAULT_MAX_AGE = 150;
    public static final long DEFAULT_MAX_INCOME = 1_000_000_000_000L;

    public DomainBounds {
        Objects.requireNonNull(age, "age");
        Objects.requireNonNull(income, "income");
        Objects.requireNonNull(earliestDate, "earliestDate");
        Objects.requireNonNull(latestDate, "latestDate");
        if (age.isEmpty() || income.isEmpty() || earliestDate.isAfter(latestDate)) {
            throw new IllegalArgumentException("domain bounds must be non-empty");
        }
    }

    public static DomainBounds defaults() {
        return new DomainBounds(
                Interval.of(0, DEFAULT_MAX_AGE),
                Interval.of(0, DEFAULT_MAX_INCOME),
                LocalDate.of(1, 1, 1),
                LocalDate.of(9999, 12, 31));
    }

    /**
     * Initial domain of an integer variable.
     */
    public Interval intervalFor(Variable variable) {
        return switch (variable.name()) {
            case ConstraintEncoder.AGE -> age;
            case ConstraintEncoder.INCOME -> income;
            case ConstraintEncoder.DATE -> Interval.of(earliestDate.toEpochDay(), latestDate.toEpochDay());
            default -> Interval.ALL;
        };
    }
}
