package com.trigger.exception;

/**
 * Exception thrown when rule source cannot be parsed.
 */
public class RuleParseException extends TriggerException {

    public RuleParseException(String message) {
        super(message);
    }
}
