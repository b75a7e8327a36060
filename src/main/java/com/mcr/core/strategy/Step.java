package com.mcr.core.strategy;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * One node of a strategy graph.
 *
 * @param inputs names of prior step outputs or initial artifacts this step reads
 */
public record Step(String id, String name, List<String> inputs, StepAction action) implements Serializable {

    public Step {
        Objects.requireNonNull(id, "step id");
        Objects.requireNonNull(action, "action of step " + id);
        name = name == null ? id : name;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }
}
