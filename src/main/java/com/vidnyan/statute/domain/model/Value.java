package com.vidnyan.statute.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Closed set of fact values an entity can expose.
 */
public sealed interface Value {

    record IntValue(long value) implements Value {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record BoolValue(boolean value) implements Value {
        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record DateValue(LocalDate value) implements Value {
        public DateValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return value;
        }
    }

    static Value of(long value) {
        return new IntValue(value);
    }

    static Value of(boolean value) {
        return new BoolValue(value);
    }

    static Value of(LocalDate value) {
        return new DateValue(value);
    }

    static Value of(String value) {
        return new StringValue(value);
    }
}
