package com.mcr.core.router;

/**
 * Aggregated performance of one strategy for one input class and model.
 *
 * @param meanLatencyMs mean of the known latencies, {@code null} when none were recorded
 * @param meanCost      mean of the known token costs, {@code null} when none were recorded
 */
public record StrategyScore(
    String strategyHash,
    double meanScore,
    int successCount,
    Double meanLatencyMs,
    Double meanCost,
    int samples
) {}
