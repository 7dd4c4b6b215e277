package com.vidnyan.statute.domain.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Window during which a statute is in force. Both bounds are inclusive and optional.
 */
public record TemporalValidity(
    Optional<LocalDate> effectiveDate,
    Optional<LocalDate> expiryDate
) {

    public static final TemporalValidity UNBOUNDED = new TemporalValidity(Optional.empty(), Optional.empty());

    public TemporalValidity {
        Objects.requireNonNull(effectiveDate, "effectiveDate");
        Objects.requireNonNull(expiryDate, "expiryDate");
        if (effectiveDate.isPresent() && expiryDate.isPresent()
                && effectiveDate.get().isAfter(expiryDate.get())) {
            throw new IllegalArgumentException(
                    "expiry date " + expiryDate.get() + " is before effective date " + effectiveDate.get());
        }
    }

    /**
     * Create from nullable bounds.
     */
    public static TemporalValidity of(LocalDate effective, LocalDate expiry) {
        return new TemporalValidity(Optional.ofNullable(effective), Optional.ofNullable(expiry));
    }

    /**
     * Check whether the window contains the given date.
     */
    public boolean isActive(LocalDate asOf) {
        boolean afterEffective = effectiveDate.map(d -> !asOf.isBefore(d)).orElse(true);
        boolean beforeExpiry = expiryDate.map(d -> !asOf.isAfter(d)).orElse(true);
        return afterEffective && beforeExpiry;
    }

    /**
     * Check whether some date lies in both windows.
     */
    public boolean overlaps(TemporalValidity other) {
        LocalDate start = later(effectiveDate, other.effectiveDate);
        LocalDate end = earlier(expiryDate, other.expiryDate);
        return start == null || end == null || !start.isAfter(end);
    }

    public boolean isUnbounded() {
        return effectiveDate.isEmpty() && expiryDate.isEmpty();
    }

    private static LocalDate later(Optional<LocalDate> a, Optional<LocalDate> b) {
        if (a.isEmpty()) return b.orElse(null);
        if (b.isEmpty()) return a.get();
        return a.get().isAfter(b.get()) ? a.get() : b.get();
    }

    private static LocalDate earlier(Optional<LocalDate> a, Optional<LocalDate> b) {
        if (a.isEmpty()) return b.orElse(null);
        if (b.isEmpty()) return a.get();
        return a.get().isBefore(b.get()) ? a.get() : b.get();
    }

    @Override
    public String toString() {
        if (effectiveDate.isPresent() && expiryDate.isPresent()) {
            return "valid " + effectiveDate.get() + " to " + expiryDate.get();
        }
        if (effectiveDate.isPresent()) {
            return "effective from " + effectiveDate.get();
        }
        if (expiryDate.isPresent()) {
            return "expires " + expiryDate.get();
        }
        return "no temporal constraints";
    }
}
