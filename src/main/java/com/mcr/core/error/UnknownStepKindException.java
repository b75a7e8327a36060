package com.mcr.core.error;

/**
 * Thrown when a step's action kind has no registered handler.
 */
public class UnknownStepKindException extends McrException {

    public UnknownStepKindException(String message) {
        super(ErrorCategory.CONFIGURATION, "UNKNOWN_STEP_KIND", message);
    }
}
