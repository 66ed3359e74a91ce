package com.ewsaccount.errors;

/**
 * Malformed account identity, e.g. a primary address without a domain
 */
public class InvalidIdentityException extends EwsAccountException {
    private static final long serialVersionUID = 1L;

    public InvalidIdentityException(String message) {
        super(message);
    }

    public InvalidIdentityException(Throwable cause) {
        super(cause);
    }

    public InvalidIdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
