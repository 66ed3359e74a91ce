package com.ewsaccount.errors;

/**
 * No folder could be chosen as the default for a well-known type
 */
public class NoUsableDefaultException extends EwsAccountException {
    private static final long serialVersionUID = 1L;

    public NoUsableDefaultException(String message) {
        super(message);
    }

    public NoUsableDefaultException(Throwable cause) {
        super(cause);
    }

    public NoUsableDefaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
