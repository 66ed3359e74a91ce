package com.ewsaccount.errors;

/**
 * Contradictory or missing protocol sources (autodiscovery vs. explicit config)
 */
public class ConfigurationConflictException extends EwsAccountException {
    private static final long serialVersionUID = 1L;

    public ConfigurationConflictException(String message) {
        super(message);
    }

    public ConfigurationConflictException(Throwable cause) {
        super(cause);
    }

    public ConfigurationConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
