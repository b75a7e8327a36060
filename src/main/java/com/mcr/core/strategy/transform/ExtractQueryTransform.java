package com.mcr.core.strategy.transform;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.error.ValidationFailedException;
import com.mcr.core.strategy.StepInput;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Normalises generated text into a single {@code FORMAL_QUERY}.
 */
@Component
public class ExtractQueryTransform implements TransformFunction {

    public static final String NAME = "extract_query";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Artifact apply(StepInput input, Map<String, String> params) {
        String query = TextExtraction.normalizeQuery(input.first().asText());
        if (query.isEmpty()) {
            throw new ValidationFailedException("Generated text contains no query");
        }
        if (query.contains(":-")) {
            throw new ValidationFailedException("Generated query is a rule, not a goal: " + query);
        }
        return Artifact.of(ArtifactType.FORMAL_QUERY, query);
    }
}
