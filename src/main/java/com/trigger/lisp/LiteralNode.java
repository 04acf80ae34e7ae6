package com.trigger.lisp;

import com.trigger.value.Value;

/**
 * A literal string, number, boolean or nil.
 */
public record LiteralNode(Value value, int position) implements Node {
}
