package com.ewsaccount.errors;

/**
 * Base of all errors raised by the account layer
 */
public class EwsAccountException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public EwsAccountException(String message) {
        super(message);
    }

    public EwsAccountException(Throwable cause) {
        super(cause);
    }

    public EwsAccountException(String message, Throwable cause) {
        super(message, cause);
    }
}
