package com.ewsaccount.errors;

/**
 * The requested folder does not exist server-side
 */
public class FolderNotFoundException extends EwsAccountException {
    private static final long serialVersionUID = 1L;

    public FolderNotFoundException(String message) {
        super(message);
    }

    public FolderNotFoundException(Throwable cause) {
        super(cause);
    }

    public FolderNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
