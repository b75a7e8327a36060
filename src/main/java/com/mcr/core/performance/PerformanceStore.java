package com.mcr.core.performance;

import com.mcr.core.router.InputClass;

import java.util.List;
import java.util.function.Predicate;

/**
 * Append-only history of strategy runs.
 */
public interface PerformanceStore {

    void append(PerformanceRecord record);

    List<PerformanceRecord> query(Predicate<PerformanceRecord> filter);

    /**
     * Records for one input class that apply to {@code modelId}: its own records
     * plus model-agnostic ones. A {@code null} model matches every record.
     */
    default List<PerformanceRecord> query(String modelId, InputClass inputType) {
        return query(r -> r.inputType() == inputType && r.appliesTo(modelId));
    }

    long count();

    String describe();
}
