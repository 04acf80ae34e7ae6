package com.trigger.exception;

/**
 * Exception thrown when the backing key/value store cannot be read or written.
 */
public class StoreException extends TriggerException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
