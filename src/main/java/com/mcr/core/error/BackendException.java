package com.mcr.core.error;

/**
 * Thrown when a generative, reasoner or embedding backend call fails.
 */
public class BackendException extends McrException {

    public BackendException(String message) {
        super(ErrorCategory.BACKEND, "BACKEND_ERROR", message);
    }

    public BackendException(String message, Throwable cause) {
        super(ErrorCategory.BACKEND, "BACKEND_ERROR", message, cause);
    }

    protected BackendException(String errorCode, String message, Throwable cause) {
        super(ErrorCategory.BACKEND, errorCode, message, cause);
    }
}
