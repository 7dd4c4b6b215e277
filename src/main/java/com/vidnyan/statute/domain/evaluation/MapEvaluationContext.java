package com.vidnyan.statute.domain.evaluation;

import com.vidnyan.statute.domain.model.Value;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory evaluation context backed by an immutable attribute map.
 */
public final class MapEvaluationContext implements EvaluationContext {

    private final UUID contextId;
    private final Map<String, Value> attributes;

    private MapEvaluationContext(UUID contextId, Map<String, Value> attributes) {
        this.contextId = contextId;
        this.attributes = Map.copyOf(attributes);
    }

    public static MapEvaluationContext of(Map<String, Value> attributes) {
        return new MapEvaluationContext(UUID.randomUUID(), attributes);
    }

    @Override
    public UUID contextId() {
        return contextId;
    }

    @Override
    public Optional<Value> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Map<String, Value> attributes() {
        return attributes;
    }

    /**
     * Builder for MapEvaluationContext.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID contextId = UUID.randomUUID();
        private final Map<String, Value> attributes = new HashMap<>();

        public Builder contextId(UUID id) { this.contextId = Objects.requireNonNull(id); return this; }
        public Builder attribute(String name, Value value) { attributes.put(name, value); return this; }
        public Builder attribute(String name, long value) { return attribute(name, Value.of(value)); }
        public Builder attribute(String name, boolean value) { return attribute(name, Value.of(value)); }
        public Builder attribute(String name, String value) { return attribute(name, Value.of(value)); }
        public Builder attribute(String name, LocalDate value) { return attribute(name, Value.of(value)); }
        public Builder age(long age) { return attribute("age", age); }
        public Builder income(long income) { return attribute("income", income); }
        public Builder date(LocalDate date) { return attribute("date", date); }

        public MapEvaluationContext build() {
            return new MapEvaluationContext(contextId, attributes);
        }
    }
}
