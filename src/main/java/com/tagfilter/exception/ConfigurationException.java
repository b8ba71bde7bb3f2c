package com.tagfilter.exception;

/**
 * Exception thrown when a filter expression or configuration file is invalid.
 * Results in fail-fast at load time.
 */
public class ConfigurationException extends TagFilterException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
