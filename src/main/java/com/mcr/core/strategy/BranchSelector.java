package com.mcr.core.strategy;

import com.mcr.core.artifact.Artifact;

import java.util.List;

/**
 * Resolves decision points: steps with more than one outgoing edge. The
 * executor never evaluates conditions itself.
 */
@FunctionalInterface
public interface BranchSelector {

    /**
     * @return one of {@code candidates}
     */
    String select(StrategyGraph graph, Step decisionStep, Artifact output, List<String> candidates);
}
