package com.mcr.core.performance;

import com.mcr.core.router.InputClass;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one strategy run, appended to the performance history.
 *
 * @param strategyHash hash of the strategy graph that ran
 * @param exampleId    caller-chosen id of the evaluated example, nullable
 * @param inputType    request class the strategy served
 * @param metrics      evaluation metrics by name; truthy values count as successes
 * @param latencyMs    wall-clock duration, {@code null} when unknown
 * @param costTokens   token cost, {@code null} when unknown
 * @param modelId      generative model that ran, {@code null} for model-agnostic records
 * @param createdAt    when the record was taken
 */
public record PerformanceRecord(
    String strategyHash,
    String exampleId,
    InputClass inputType,
    Map<String, Object> metrics,
    Long latencyMs,
    Long costTokens,
    String modelId,
    Instant createdAt
) implements Serializable {

    public PerformanceRecord {
        Objects.requireNonNull(strategyHash, "strategyHash");
        Objects.requireNonNull(inputType, "inputType");
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    /**
     * Records without a model id apply to every model.
     */
    public boolean appliesTo(String model) {
        return model == null || modelId == null || modelId.isBlank() || modelId.equals(model);
    }
}
