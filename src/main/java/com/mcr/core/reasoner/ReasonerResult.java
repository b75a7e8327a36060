package com.mcr.core.reasoner;

import java.io.Serializable;
import java.util.List;

/**
 * Answers to a query. Each entry in {@code results} is one solution rendered as
 * variable bindings ({@code "Who = pete"}), or {@code "true"} for a ground query.
 * {@code proof} lists the instantiated goals, one line per solution, and is
 * {@code null} when there were none.
 */
public record ReasonerResult(List<String> results, String proof) implements Serializable {

    public ReasonerResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ReasonerResult empty() {
        return new ReasonerResult(List.of(), null);
    }

    public boolean hasResults() {
        return !results.isEmpty();
    }
}
