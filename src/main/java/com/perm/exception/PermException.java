package com.perm.exception;

/**
 * Base exception for the PERM rules engine.
 */
public class PermException extends RuntimeException {

    public PermException(String message) {
        super(message);
    }

    public PermException(String message, Throwable cause) {
        super(message, cause);
    }
}
