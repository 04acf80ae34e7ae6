package com.trigger.value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of nested values. Equality is element-wise.
 */
public record ListValue(List<Value> items) implements Value {

    public ListValue {
        items = List.copyOf(items);
    }

    @Override
    public ValueType type() {
        return ValueType.LIST;
    }

    @Override
    public String toString() {
        return items.stream()
                .map(Value::toString)
                .collect(Collectors.joining(" ", "(", ")"));
    }
}
