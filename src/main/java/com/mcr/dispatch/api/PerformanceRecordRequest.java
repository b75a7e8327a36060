package com.mcr.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/strategies/performance. The strategy is
 * named either by id or by hash.
 */
public record PerformanceRecordRequest(
    @JsonProperty("strategy_id") String strategyId,
    @JsonProperty("strategy_hash") String strategyHash,
    @JsonProperty("example_id") String exampleId,
    @JsonProperty("input_type") String inputType,
    Map<String, Object> metrics,
    @JsonProperty("latency_ms") Long latencyMs,
    @JsonProperty("cost_tokens") Long costTokens,
    @JsonProperty("model_id") String modelId
) {}
