package com.mcr.core.performance;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Process-local performance history, lost on restart.
 */
public class InMemoryPerformanceStore implements PerformanceStore {

    private final CopyOnWriteArrayList<PerformanceRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(PerformanceRecord record) {
        records.add(record);
    }

    @Override
    public List<PerformanceRecord> query(Predicate<PerformanceRecord> filter) {
        return records.stream().filter(filter).toList();
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public String describe() {
        return "in-memory";
    }
}
