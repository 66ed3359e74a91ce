package com.ewsaccount.errors;

/**
 * The account lacks rights for the requested remote operation
 */
public class AccessDeniedException extends EwsAccountException {
    private static final long serialVersionUID = 1L;

    public AccessDeniedException(String message) {
        super(message);
    }

    public AccessDeniedException(Throwable cause) {
        super(cause);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
