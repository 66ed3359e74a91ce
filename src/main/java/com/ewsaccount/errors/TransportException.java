package com.ewsaccount.errors;

/**
 * Opaque failure from the call layer. Never interpreted by the account layer.
 */
public class TransportException extends EwsAccountException {
    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(Throwable cause) {
        super(cause);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
