package com.trigger.exception;

/**
 * Exception thrown when a stored variable record cannot be decoded.
 */
public class ValueDecodeException extends TriggerException {

    public ValueDecodeException(String message) {
        super(message);
    }

    public ValueDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
