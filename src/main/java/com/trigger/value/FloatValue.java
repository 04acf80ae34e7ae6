package com.trigger.value;

/**
 * Double precision floating point value.
 */
public record FloatValue(double value) implements Value {

    @Override
    public ValueType type() {
        return ValueType.FLOAT;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
