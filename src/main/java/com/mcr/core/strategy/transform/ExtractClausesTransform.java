package com.mcr.core.strategy.transform;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.error.ValidationFailedException;
import com.mcr.core.strategy.StepInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Splits generated text into clauses as a {@code FORMAL_KB} artifact.
 */
@Component
public class ExtractClausesTransform implements TransformFunction {

    public static final String NAME = "extract_clauses";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Artifact apply(StepInput input, Map<String, String> params) {
        List<String> clauses = TextExtraction.extractClauses(input.first().asText());
        if (clauses.isEmpty()) {
            throw new ValidationFailedException("Generated text contains no clauses");
        }
        return Artifact.of(ArtifactType.FORMAL_KB, clauses);
    }
}
