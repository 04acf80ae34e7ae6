package com.trigger.lisp;

import com.trigger.value.Value;

/**
 * Symbol table an expression is evaluated against.
 * <p>
 * Scopes form a chain: lookups and assignments that a scope cannot satisfy locally
 * are forwarded to its parent.
 */
public interface Scope {

    /**
     * Resolve a symbol.
     *
     * @throws com.trigger.exception.UndefinedSymbolException if no scope in the chain binds it
     */
    Value get(String symbol);

    /**
     * Assign an existing binding, or forward the assignment to the parent.
     */
    void set(String symbol, Value value);

    /**
     * Declare a new binding in this scope.
     */
    void create(String symbol, Value value);

    /**
     * Create a child scope whose parent is this scope.
     */
    Scope branch();

    /**
     * Attach a parent to this scope.
     */
    void enclose(Scope parent);

    /**
     * Evaluate a node against this scope.
     *
     * @throws com.trigger.exception.EvaluationException on any runtime error
     */
    Value eval(Node node);
}
