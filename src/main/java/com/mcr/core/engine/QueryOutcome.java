package com.mcr.core.engine;

import com.mcr.core.deduction.ScoredProof;
import com.mcr.core.refine.RefinementAttempt;
import com.mcr.core.router.InputClass;

import java.util.List;

/**
 * @param query  the formal query the question translated to
 * @param proofs scored answers, empty when nothing in the knowledge base supports the question
 * @param answer natural language answer
 */
public record QueryOutcome(
    String sessionId,
    String strategyId,
    String query,
    List<ScoredProof> proofs,
    String answer,
    int iterations,
    List<RefinementAttempt> history,
    long latencyMs
) implements McrOutcome {

    public QueryOutcome {
        proofs = List.copyOf(proofs);
        history = List.copyOf(history);
    }

    @Override
    public InputClass inputClass() {
        return InputClass.QUERY;
    }
}
