package com.trigger.lisp;

import com.trigger.value.Value;
import com.trigger.value.ValueType;

import java.util.List;

/**
 * A callable bound to a name in a scope. Two function values are equal only when
 * they wrap the same callable.
 */
public record FunctionValue(String name, Callable callable) implements Value {

    @Override
    public ValueType type() {
        return ValueType.FUNCTION;
    }

    public Value call(List<Value> args) {
        return callable.call(args);
    }

    @Override
    public String toString() {
        return "<func " + name + ">";
    }
}
