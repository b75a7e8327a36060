package com.mcr.core.error;

/**
 * Base class for every failure raised by the translation and reasoning core.
 */
public abstract class McrException extends RuntimeException {

    private final ErrorCategory category;
    private final String errorCode;

    protected McrException(ErrorCategory category, String errorCode, String message) {
        super(message);
        this.category = category;
        this.errorCode = errorCode;
    }

    protected McrException(ErrorCategory category, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.errorCode = errorCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Configuration and not-found failures are fatal for the current request.
     */
    public boolean isRetryable() {
        return category == ErrorCategory.VALIDATION || category == ErrorCategory.BACKEND;
    }
}
