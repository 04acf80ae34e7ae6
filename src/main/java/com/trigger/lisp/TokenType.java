package com.trigger.lisp;

/**
 * Token types of rule source.
 */
public enum TokenType {
    // Delimiters
    LPAREN,
    RPAREN,

    // Literals
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    NULL,

    // Names of variables, functions and special forms
    SYMBOL,

    // Special
    EOF
}
