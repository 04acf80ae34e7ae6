package com.trigger.variable;

import com.trigger.value.Value;

/**
 * Notification that a variable took a new value.
 *
 * @param name  Variable name (never prefixed)
 * @param value New value
 */
public record ChangeEvent(String name, Value value) {
}
