package com.trigger.value;

/**
 * The {@code nil} value, returned by actions that produce no result.
 */
public record NullValue() implements Value {

    public static final NullValue INSTANCE = new NullValue();

    @Override
    public ValueType type() {
        return ValueType.NULL;
    }

    @Override
    public boolean isTruthy() {
        return false;
    }

    @Override
    public String toString() {
        return "nil";
    }
}
