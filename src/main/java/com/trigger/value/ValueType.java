package com.trigger.value;

/**
 * Tags of the dynamically-typed value domain.
 */
public enum ValueType {
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN,
    NULL,
    LIST,

    /**
     * Callable values. They live only inside the interpreter and are never persisted.
     */
    FUNCTION
}
