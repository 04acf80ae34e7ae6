package com.trigger.value;

import java.util.List;

/**
 * A value held by a variable or produced by a rule expression.
 * <p>
 * Values are a tagged variant: every implementation reports a fixed {@link ValueType}
 * and implements {@code equals} as deep equality over its payload. Values with
 * different tags are never equal, so {@code 1} and {@code 1.0} are distinct.
 */
public interface Value {

    ValueType type();

    /**
     * Whether this value counts as true in a condition.
     * Only {@code false} and {@code nil} are falsy.
     */
    default boolean isTruthy() {
        return true;
    }

    /**
     * Human-readable rendering, used by string concatenation and log output.
     */
    default String display() {
        return toString();
    }

    static IntegerValue of(long value) {
        return new IntegerValue(value);
    }

    static FloatValue of(double value) {
        return new FloatValue(value);
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static BooleanValue of(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static ListValue list(Value... items) {
        return new ListValue(List.of(items));
    }

    static NullValue nil() {
        return NullValue.INSTANCE;
    }
}
