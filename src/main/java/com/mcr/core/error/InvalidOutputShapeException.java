package com.mcr.core.error;

/**
 * Thrown when a strategy run ends with an artifact whose type differs from the
 * graph's declared output type, or when artifact content does not fit its type.
 */
public class InvalidOutputShapeException extends McrException {

    public InvalidOutputShapeException(String message) {
        super(ErrorCategory.CONFIGURATION, "INVALID_OUTPUT_SHAPE", message);
    }
}
