package com.mcr.core.engine;

import com.mcr.core.refine.RefinementAttempt;
import com.mcr.core.router.InputClass;

import java.util.List;

/**
 * Result of handling one natural language request.
 */
public sealed interface McrOutcome permits AssertOutcome, QueryOutcome {

    InputClass inputClass();

    String sessionId();

    String strategyId();

    int iterations();

    List<RefinementAttempt> history();

    long latencyMs();
}
