package com.trigger.lisp;

/**
 * A bare name, resolved through the scope at evaluation time.
 */
public record SymbolNode(String name, int position) implements Node {
}
