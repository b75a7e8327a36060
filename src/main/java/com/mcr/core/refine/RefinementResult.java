package com.mcr.core.refine;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.error.ValidationFailedException;

import java.util.List;

/**
 * Outcome of a refinement loop. When {@code converged} is false the result is
 * the last candidate produced, which failed validation.
 */
public record RefinementResult(Artifact result, int iterations, boolean converged, List<RefinementAttempt> history) {

    public RefinementResult {
        history = List.copyOf(history);
    }

    /**
     * @throws ValidationFailedException carrying the history when the loop did not converge
     */
    public Artifact requireConverged() {
        if (!converged) {
            String last = history.isEmpty() ? "unknown error" : history.get(history.size() - 1).error();
            throw new ValidationFailedException("No valid output after " + iterations
                    + " iteration(s): " + last, history);
        }
        return result;
    }
}
