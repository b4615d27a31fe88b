package com.perm.exception;

/**
 * Exception thrown when the rules configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends PermException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
