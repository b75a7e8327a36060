package com.mcr.core.error;

import com.mcr.core.refine.RefinementAttempt;

import java.util.List;

/**
 * Thrown when generated formal text is rejected by the reasoner's validator.
 * Carries the refinement history when raised at the end of a refinement loop.
 */
public class ValidationFailedException extends McrException {

    private final List<RefinementAttempt> history;

    public ValidationFailedException(String message) {
        this(message, List.of());
    }

    public ValidationFailedException(String message, List<RefinementAttempt> history) {
        super(ErrorCategory.VALIDATION, "VALIDATION_FAILED", message);
        this.history = List.copyOf(history);
    }

    public List<RefinementAttempt> getHistory() {
        return history;
    }
}
