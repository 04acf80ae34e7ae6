package com.trigger.exception;

/**
 * Base exception for the trigger engine.
 */
public class TriggerException extends RuntimeException {

    public TriggerException(String message) {
        super(message);
    }

    public TriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
