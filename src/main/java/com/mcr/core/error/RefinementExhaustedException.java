package com.mcr.core.error;

import com.mcr.core.refine.RefinementAttempt;

import java.util.List;

/**
 * Raised when the operation of the final refinement iteration fails. The cause
 * is the failure of that last attempt; the history covers every attempt.
 */
public class RefinementExhaustedException extends BackendException {

    private final List<RefinementAttempt> history;

    public RefinementExhaustedException(String message, List<RefinementAttempt> history, Throwable cause) {
        super("REFINEMENT_EXHAUSTED", message, cause);
        this.history = List.copyOf(history);
    }

    public List<RefinementAttempt> getHistory() {
        return history;
    }
}
