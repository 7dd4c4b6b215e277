package com.vidnyan.statute.domain.constraint;

import com.vidnyan.statute.domain.model.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Satisfying assignment, keyed by variable name in sorted order.
 */
public record Model(Map<String, Value> assignments) {

    public static final Model EMPTY = new Model(Map.of());

    public Model {
        assignments = Collections.unmodifiableMap(new TreeMap<>(assignments));
    }

    public Optional<Value> get(String name) {
        return Optional.ofNullable(assignments.get(name));
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    @Override
    public String toString() {
        return assignments.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
