package com.perm.exception;

/**
 * Exception thrown when a date string is not a valid ISO {@code YYYY-MM-DD} civil date.
 */
public class MalformedDateException extends MalformedInputException {

    private final String rawValue;

    public MalformedDateException(String rawValue) {
        super("Malformed date '" + rawValue + "', expected YYYY-MM-DD");
        this.rawValue = rawValue;
    }

    public MalformedDateException(String rawValue, Throwable cause) {
        super("Malformed date '" + rawValue + "', expected YYYY-MM-DD", cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
