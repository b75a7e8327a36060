package com.mcr.core.strategy.transform;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.artifact.ArtifactType;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.strategy.StepInput;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits text into a {@code FORMAL_KB} of non-blank pieces. Parameters:
 * {@code delimiter} (literal, default line breaks) and {@code limit}.
 */
@Component
public class SplitLinesTransform implements TransformFunction {

    public static final String NAME = "split_lines";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Artifact apply(StepInput input, Map<String, String> params) {
        String body = TextExtraction.stripCodeFence(input.first().asText());
        String delimiter = params.get("delimiter");
        String regex = delimiter == null || delimiter.isEmpty() ? "\\R" : Pattern.quote(delimiter);
        List<String> pieces = Arrays.stream(body.split(regex))
                .map(String::strip)
                .filter(piece -> !piece.isEmpty() && !piece.startsWith("%"))
                .limit(limit(params))
                .toList();
        return Artifact.of(ArtifactType.FORMAL_KB, pieces);
    }

    private static long limit(Map<String, String> params) {
        String raw = params.get("limit");
        if (raw == null) {
            return Long.MAX_VALUE;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new StrategyDefinitionException("split_lines limit must be a number, got '" + raw + "'", e);
        }
    }
}
