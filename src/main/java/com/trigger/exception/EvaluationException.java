package com.trigger.exception;

/**
 * Exception thrown while evaluating a rule program.
 */
public class EvaluationException extends TriggerException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
