package com.vidnyan.statute.domain.constraint;

import java.util.Objects;

/**
 * Sorted constraint variable. Two variables are the same only if name and sort match.
 */
public record Variable(
    String name,
    VariableSort sort
) implements Comparable<Variable> {

    public Variable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sort, "sort");
    }

    public static Variable intVar(String name) {
        return new Variable(name, VariableSort.INT);
    }

    public static Variable boolVar(String name) {
        return new Variable(name, VariableSort.BOOL);
    }

    public static Variable stringVar(String name) {
        return new Variable(name, VariableSort.STRING);
    }

    @Override
    public int compareTo(Variable other) {
        int byName = name.compareTo(other.name);
        return byName != 0 ? byName : sort.compareTo(other.sort);
    }

    @Override
    public String toString() {
        return name + ":" + sort.name().toLowerCase();
    }
}
