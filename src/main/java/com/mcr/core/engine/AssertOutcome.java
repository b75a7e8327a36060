package com.mcr.core.engine;

import com.mcr.core.refine.RefinementAttempt;
import com.mcr.core.router.InputClass;

import java.util.List;

/**
 * @param addedFacts clauses appended to the session; clauses it already held are not repeated
 */
public record AssertOutcome(
    String sessionId,
    String strategyId,
    List<String> addedFacts,
    int iterations,
    List<RefinementAttempt> history,
    long latencyMs
) implements McrOutcome {

    public AssertOutcome {
        addedFacts = List.copyOf(addedFacts);
        history = List.copyOf(history);
    }

    @Override
    public InputClass inputClass() {
        return InputClass.ASSERT;
    }
}
