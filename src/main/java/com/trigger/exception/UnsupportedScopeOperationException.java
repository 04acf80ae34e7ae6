package com.trigger.exception;

/**
 * Exception thrown when a scope is asked for an operation it does not support,
 * such as declaring a binding directly in the variable-backed global scope.
 */
public class UnsupportedScopeOperationException extends EvaluationException {

    private final String operation;

    public UnsupportedScopeOperationException(String operation) {
        super("operation not supported at global scope: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
