package com.sassed.error;

/**
 * Filesystem or configuration failure, raised before any compilation work starts.
 */
public class SassRuntimeException extends SassException {
    public SassRuntimeException(String message) {
        super(message, null);
    }

    public SassRuntimeException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
