package com.trigger.exception;

/**
 * Exception thrown when a function is called with the wrong number or type of arguments.
 */
public class ArgumentException extends EvaluationException {

    public ArgumentException(String message) {
        super(message);
    }
}
