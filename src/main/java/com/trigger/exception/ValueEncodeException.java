package com.trigger.exception;

/**
 * Exception thrown when a value has no persisted representation.
 */
public class ValueEncodeException extends TriggerException {

    public ValueEncodeException(String message) {
        super(message);
    }

    public ValueEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
