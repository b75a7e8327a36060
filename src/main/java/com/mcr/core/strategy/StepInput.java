package com.mcr.core.strategy;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.error.StrategyDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Artifacts handed to a step handler.
 *
 * @param strategyId the running strategy
 * @param named      the step's resolved inputs, keyed by reference, in declaration order
 * @param available  every artifact of the run so far: initial ones by name, step outputs by step id
 */
public record StepInput(String strategyId, Map<String, Artifact> named, Map<String, Artifact> available) {

    public StepInput {
        named = Collections.unmodifiableMap(new LinkedHashMap<>(named));
        available = Collections.unmodifiableMap(new LinkedHashMap<>(available));
    }

    public List<Artifact> ordered() {
        return new ArrayList<>(named.values());
    }

    public Artifact first() {
        if (named.isEmpty()) {
            throw new StrategyDefinitionException("Step in strategy " + strategyId + " received no input");
        }
        return named.values().iterator().next();
    }

    public Artifact require(String ref) {
        Artifact artifact = named.get(ref);
        if (artifact == null) {
            artifact = available.get(ref);
        }
        if (artifact == null) {
            throw new StrategyDefinitionException("Strategy " + strategyId + " has no artifact named '" + ref + "'");
        }
        return artifact;
    }

    /**
     * Text of every available artifact plus the named inputs, for template filling.
     * {@code input} is bound to the first named input.
     */
    public Map<String, String> templateVariables() {
        var vars = new LinkedHashMap<String, String>();
        available.forEach((k, v) -> vars.put(k, v.asText()));
        named.forEach((k, v) -> vars.put(k, v.asText()));
        if (!named.isEmpty()) {
            vars.put("input", first().asText());
        }
        return vars;
    }
}
