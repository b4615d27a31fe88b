package com.perm.exception;

/**
 * Exception thrown when a caller passes input the engine cannot interpret:
 * an unknown field or deadline identifier, an unknown enum value, or a payload
 * that is not valid JSON.
 * <p>
 * Domain problems (rule violations, superseded deadlines) are never reported
 * through this exception; they are returned as values.
 */
public class MalformedInputException extends PermException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
