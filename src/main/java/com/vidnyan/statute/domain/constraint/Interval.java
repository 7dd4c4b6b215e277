package com.vidnyan.statute.domain.constraint;

/**
 * Closed integer interval {@code [low, high]}. May be empty when {@code low > high}.
 */
public record Interval(
    long low,
    long high
) {

    public static final Interval ALL = new Interval(Long.MIN_VALUE, Long.MAX_VALUE);

    public static Interval of(long low, long high) {
        return new Interval(low, high);
    }

    public boolean isEmpty() {
        return low > high;
    }

    public boolean contains(long value) {
        return value >= low && value <= high;
    }

    public Interval intersect(Interval other) {
        return new Interval(Math.max(low, other.low), Math.min(high, other.high));
    }

    @Override
    public String toString() {
        return "[" + low + ", " + high + "]";
    }
}
