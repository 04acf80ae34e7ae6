package com.trigger.value;

/**
 * 64-bit integer value.
 */
public record IntegerValue(long value) implements Value {

    @Override
    public ValueType type() {
        return ValueType.INTEGER;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
