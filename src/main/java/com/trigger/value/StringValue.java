package com.trigger.value;

import java.util.Objects;

/**
 * String value.
 */
public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public ValueType type() {
        return ValueType.STRING;
    }

    @Override
    public String display() {
        return value;
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
