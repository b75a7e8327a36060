package com.mcr.core.strategy.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.strategy.StepInput;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class SirToClausesTransform implements TransformFunction {

    public static final String NAME = "sir_to_clauses";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Artifact apply(StepInput input, Map<String, String> params) {
        JsonNode sir = input.first().contentAs(JsonNode.class);
        return Artifact.of(ArtifactType.FORMAL_KB, SirConverter.toClauses(sir));
    }
}
