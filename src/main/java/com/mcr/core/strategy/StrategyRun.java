package com.mcr.core.strategy;

import com.mcr.core.artifact.Artifact;

import java.util.List;
import java.util.Map;

/**
 * Result of one strategy execution.
 */
public record StrategyRun(
    String strategyId,
    Artifact output,
    Map<String, Artifact> stepOutputs,
    List<String> executedSteps,
    long durationMs
) {}
